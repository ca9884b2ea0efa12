package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.exec.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Transaction bound to one pooled connection.
 *
 * <p>Statements and the finishing call synchronize on this object, so dependent steps running on other threads
 * share the connection one statement at a time. The connection returns to the pool once committed or rolled back.
 * A failed commit leaves the transaction active so the owner can still roll back.</p>
 */
public final class JdbcTransaction implements Transaction {
  private static final Logger log = LoggerFactory.getLogger(JdbcTransaction.class);

  private enum State { ACTIVE, COMMITTED, ROLLED_BACK }

  private final Connection conn;
  private State state = State.ACTIVE;

  public JdbcTransaction(Connection conn) {
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  /** Connection for statement execution; callers hold this object's monitor. */
  Connection connection() {
    requireActive();
    return conn;
  }

  @Override
  public synchronized void commit() {
    requireActive();
    try {
      conn.commit();
    } catch (SQLException e) {
      throw new SqlExecutionException("COMMIT", e);
    }
    state = State.COMMITTED;
    close();
  }

  @Override
  public synchronized void rollback() {
    requireActive();
    state = State.ROLLED_BACK;
    try {
      conn.rollback();
    } catch (SQLException e) {
      throw new SqlExecutionException("ROLLBACK", e);
    } finally {
      close();
    }
  }

  @Override
  public synchronized boolean isActive() {
    return state == State.ACTIVE;
  }

  private void requireActive() {
    if (state != State.ACTIVE) throw new IllegalStateException("Transaction already " + state);
  }

  private void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      log.warn("relata.jdbc tx connection close failed: {}", e.getMessage());
    }
  }
}
