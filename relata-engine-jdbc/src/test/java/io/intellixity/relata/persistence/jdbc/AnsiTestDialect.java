package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.config.DatabaseConfig;
import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.persistence.query.OffsetPage;

/** Double-quoted identifiers, LIMIT/OFFSET paging and RETURNING keys. */
public final class AnsiTestDialect extends AbstractJdbcSqlDialect {
  private final int maxBinds;
  private final int maxRows;

  public AnsiTestDialect() {
    this(32_767, Integer.MAX_VALUE);
  }

  /** A dialect with a server-style bind and VALUES-row ceiling. */
  public AnsiTestDialect(int maxBinds, int maxRows) {
    this.maxBinds = maxBinds;
    this.maxRows = maxRows;
  }

  @Override public String id() { return "ansi"; }

  @Override public int maxBindParameters() { return maxBinds; }
  @Override public int maxInsertRows() { return maxRows; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String paginate(OffsetPage page) {
    return " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }

  @Override
  public String singleRowSubSelect(String projection, String fromClause, String where) {
    return "(SELECT " + projection + " FROM " + fromClause + (where.isBlank() ? "" : " WHERE " + where) + " LIMIT 1)";
  }

  @Override
  protected String returningAfterValues(String pk) {
    return " RETURNING " + quoteIdent(pk);
  }

  @Override public ExecKind insertReturningExecKind() { return ExecKind.QUERY; }

  @Override protected String stringType(int maxLength) { return "VARCHAR(" + maxLength + ")"; }
  @Override protected String decimalType(int precision, int scale) { return "DECIMAL(" + precision + "," + scale + ")"; }
  @Override protected String integerType() { return "INTEGER"; }
  @Override protected String wideIntegerType() { return "BIGINT"; }
  @Override protected String booleanType() { return "BOOLEAN"; }
  @Override protected String unboundedTextType() { return "TEXT"; }
  @Override public String identityClause() { return "GENERATED BY DEFAULT AS IDENTITY"; }
  @Override protected String booleanLiteral(boolean b) { return b ? "TRUE" : "FALSE"; }
  @Override public int defaultPort() { return 5000; }

  @Override
  public String jdbcUrl(DatabaseConfig c) {
    return "jdbc:ansi://" + c.host() + ":" + c.portOr(defaultPort()) + "/" + c.database();
  }
}
