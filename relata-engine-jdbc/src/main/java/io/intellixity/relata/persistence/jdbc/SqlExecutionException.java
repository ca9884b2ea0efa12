package io.intellixity.relata.persistence.jdbc;

import java.sql.SQLException;

/** A statement the database rejected; carries the JDBC SQL for diagnostics. */
public final class SqlExecutionException extends RuntimeException {
  private final String sql;

  public SqlExecutionException(String sql, SQLException cause) {
    super(cause.getMessage() + " [sqlState=" + cause.getSQLState() + "]", cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}
