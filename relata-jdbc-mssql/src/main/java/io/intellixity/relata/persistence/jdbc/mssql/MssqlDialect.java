package io.intellixity.relata.persistence.jdbc.mssql;

import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.config.DatabaseConfig;
import io.intellixity.relata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.persistence.query.OffsetPage;

/**
 * SQL Server dialect.
 *
 * Keeps only SQL Server specific overrides; generic rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class MssqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "mssql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "[" + ident.replace("]", "]]") + "]";
  }

  /** OFFSET/FETCH needs an ORDER BY; the query compiler guarantees one whenever a limit is set. */
  @Override
  public String paginate(OffsetPage page) {
    return " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }

  @Override
  public String singleRowSubSelect(String projection, String fromClause, String where) {
    return "(SELECT TOP 1 " + projection + " FROM " + fromClause + (where.isBlank() ? "" : " WHERE " + where) + ")";
  }

  @Override
  protected String returningBeforeValues(String pk) {
    return " OUTPUT INSERTED." + quoteIdent(pk);
  }

  @Override
  public ExecKind insertReturningExecKind() { return ExecKind.QUERY; }

  /** The server rejects more than 2100 parameters; keep headroom for the binds around an IN list. */
  @Override public int maxBindParameters() { return 2000; }

  /** Table value constructor limit. */
  @Override public int maxInsertRows() { return 1000; }

  @Override protected String stringType(int maxLength) { return "NVARCHAR(" + maxLength + ")"; }
  @Override protected String decimalType(int precision, int scale) { return "DECIMAL(" + precision + "," + scale + ")"; }
  @Override protected String integerType() { return "INT"; }
  @Override protected String wideIntegerType() { return "BIGINT"; }
  @Override protected String booleanType() { return "BIT"; }
  @Override protected String unboundedTextType() { return "NVARCHAR(MAX)"; }

  @Override public String identityClause() { return "IDENTITY(1,1)"; }

  @Override
  public String dropTableIfExists(String table) {
    return "IF OBJECT_ID(" + stringLiteral(table) + ", 'U') IS NOT NULL DROP TABLE " + quoteIdent(table);
  }

  @Override protected String booleanLiteral(boolean b) { return b ? "1" : "0"; }

  @Override
  protected String stringLiteral(String s) {
    return "N" + super.stringLiteral(s);
  }

  @Override public int defaultPort() { return 1433; }

  @Override
  public String jdbcUrl(DatabaseConfig c) {
    return "jdbc:sqlserver://" + c.host() + ":" + c.portOr(defaultPort())
        + ";databaseName=" + c.database() + ";encrypt=false";
  }
}
