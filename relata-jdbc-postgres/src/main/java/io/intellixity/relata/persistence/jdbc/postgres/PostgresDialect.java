package io.intellixity.relata.persistence.jdbc.postgres;

import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.config.DatabaseConfig;
import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.persistence.query.OffsetPage;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
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

  @Override
  public ExecKind insertReturningExecKind() { return ExecKind.QUERY; }

  @Override protected String stringType(int maxLength) { return "VARCHAR(" + maxLength + ")"; }
  @Override protected String decimalType(int precision, int scale) { return "NUMERIC(" + precision + "," + scale + ")"; }
  @Override protected String integerType() { return "INTEGER"; }
  @Override protected String wideIntegerType() { return "BIGINT"; }
  @Override protected String booleanType() { return "BOOLEAN"; }
  @Override protected String unboundedTextType() { return "TEXT"; }

  @Override public String identityClause() { return "GENERATED BY DEFAULT AS IDENTITY"; }

  @Override protected String booleanLiteral(boolean b) { return b ? "TRUE" : "FALSE"; }

  @Override public int defaultPort() { return 5432; }

  @Override
  public String jdbcUrl(DatabaseConfig c) {
    return "jdbc:postgresql://" + c.host() + ":" + c.portOr(defaultPort()) + "/" + c.database();
  }
}
