package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.schema.FieldType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Named-parameter collector for one statement: values in, {@code :bN} placeholders out. */
public final class SqlParams {
  private int n = 1;
  private final Map<String, Bind> binds = new LinkedHashMap<>();

  public String add(Object value, FieldType type) {
    return add(new Bind(value, type == null ? Bind.of(value).type() : type));
  }

  public String add(Object value) {
    return add(Bind.of(value));
  }

  public String add(Bind b) {
    String name = "b" + (n++);
    binds.put(name, b);
    return ":" + name;
  }

  /** {@code (:b1, :b2, ...)} for an IN list; callers handle the empty case. */
  public String inList(Collection<?> values, FieldType type) {
    if (values.isEmpty()) throw new IllegalArgumentException("IN list is empty");
    StringBuilder sb = new StringBuilder("(");
    int i = 0;
    for (Object v : values) {
      if (i++ > 0) sb.append(", ");
      sb.append(add(v, type));
    }
    return sb.append(')').toString();
  }

  public Map<String, Bind> asMap() { return binds; }

  public int size() { return binds.size(); }

  public SqlStatement statement(String sql, SqlStatement.ExecKind kind) {
    return NamedParamSql.compile(sql, binds, kind);
  }

  public SqlStatement query(String sql) { return statement(sql, SqlStatement.ExecKind.QUERY); }

  public SqlStatement update(String sql) { return statement(sql, SqlStatement.ExecKind.UPDATE); }

  public static SqlStatement noParams(String sql, SqlStatement.ExecKind kind) {
    return new SqlStatement(sql, List.of(), kind);
  }
}
