package io.intellixity.relata.persistence.jdbc;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcTransactionTest {
  private final List<String> calls = new ArrayList<>();

  private Connection connection(boolean failCommit) {
    return (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          calls.add(method.getName());
          if (failCommit && method.getName().equals("commit")) throw new SQLException("deadlock");
          return null;
        });
  }

  @Test
  void commitReleasesConnectionOnce() {
    JdbcTransaction tx = new JdbcTransaction(connection(false));

    tx.commit();

    assertFalse(tx.isActive());
    assertEquals(List.of("commit", "close"), calls);
    assertThrows(IllegalStateException.class, tx::commit);
    assertThrows(IllegalStateException.class, tx::rollback);
  }

  @Test
  void failedCommitStaysActiveForRollback() {
    JdbcTransaction tx = new JdbcTransaction(connection(true));

    SqlExecutionException ex = assertThrows(SqlExecutionException.class, tx::commit);
    assertEquals("COMMIT", ex.sql());
    assertTrue(tx.isActive());

    tx.rollback();
    assertFalse(tx.isActive());
    assertEquals(List.of("commit", "rollback", "close"), calls);
  }

  @Test
  void finishedTransactionRejectsStatements() {
    JdbcTransaction tx = new JdbcTransaction(connection(false));
    tx.rollback();
    assertThrows(IllegalStateException.class, tx::connection);
  }
}
