package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.config.DatabaseConfig;
import io.intellixity.relata.persistence.query.OffsetPage;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.spi.sql.Dialect;

import java.util.List;

/**
 * Dialect for JDBC engines: the SQL fragments that differ between databases.
 *
 * Implementations are discovered through {@code META-INF/relata.factories} (see {@link JdbcDialects}).
 */
public interface JdbcDialect extends Dialect {

  /** {@code quoteIdent(alias).quoteIdent(column)}. */
  default String qualify(String alias, String column) {
    return quoteIdent(alias) + "." + quoteIdent(column);
  }

  /** Trailing pagination clause, with a leading space. Requires an ORDER BY on dialects that need one. */
  String paginate(OffsetPage page);

  /** Parenthesized correlated sub-select yielding at most one row. */
  String singleRowSubSelect(String projection, String fromClause, String where);

  /**
   * INSERT of {@code tuples} (each {@code "(:b1, :b2)"}) into {@code table}.
   * With a non-null {@code returningPk} the statement yields the generated keys, one row per inserted row.
   */
  String insertSql(String table, List<String> columns, List<String> tuples, String returningPk);

  /** How {@link #insertSql} statements that return keys are executed. */
  ExecKind insertReturningExecKind();

  /** Bind parameters one statement may carry. */
  default int maxBindParameters() { return 32_767; }

  /** Rows one multi-row {@code VALUES} list may carry. */
  default int maxInsertRows() { return Integer.MAX_VALUE; }

  /** Ids per IN list in a statement that binds {@code otherBinds} further values. */
  default int inListBatchSize(int otherBinds) {
    return Math.max(1, maxBindParameters() - otherBinds);
  }

  /** Rows per multi-row INSERT binding {@code bindsPerRow} values each. */
  default int insertBatchSize(int bindsPerRow) {
    return Math.max(1, Math.min(maxInsertRows(), maxBindParameters() / Math.max(1, bindsPerRow)));
  }

  /** Predicate that never matches. */
  default String falsePredicate() { return "1 = 0"; }

  // --- DDL ---

  /** Column type for {@code f}, or null when the field owns no column on its table. */
  String columnType(FieldDef f);

  /** Column type for a bare scalar, e.g. the value column of a list table. */
  String scalarType(FieldType type);

  /** Suffix turning an integer primary-key column into an auto-generated one. */
  String identityClause();

  String dropTableIfExists(String table);

  /** SQL literal for a column DEFAULT. */
  String literal(Object value);

  // --- connectivity ---

  int defaultPort();

  String jdbcUrl(DatabaseConfig config);
}
