package io.intellixity.relata.persistence.jdbc;

import java.util.List;
import java.util.Objects;

/** One prepared statement: {@code ?} placeholders, binds in placeholder order, and how to run it. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** executeQuery(); also INSERT ... RETURNING / OUTPUT INSERTED. */
    QUERY,
    /** executeUpdate(); no rows come back. */
    UPDATE,
    /** executeUpdate() and the driver's generated keys as rows. */
    UPDATE_GENERATED_KEYS
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
    if (execKind == null) execKind = ExecKind.QUERY;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  public int bindCount() { return binds.size(); }

  public List<Object> values() {
    return binds.stream().map(Bind::value).toList();
  }
}
