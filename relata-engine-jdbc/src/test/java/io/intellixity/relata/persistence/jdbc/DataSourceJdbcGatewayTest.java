package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.ErrorKind;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.schema.FieldType;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.*;
import java.util.*;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class DataSourceJdbcGatewayTest {
  private final List<String> calls = new ArrayList<>();

  @SuppressWarnings("unchecked")
  private <T> T proxy(Class<T> type, String name, Map<String, Function<Object[], Object>> answers) {
    return (T) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{type}, (p, m, args) -> {
      String call = name + "." + m.getName() + (args == null ? "" : Arrays.toString(args));
      calls.add(call);
      Function<Object[], Object> answer = answers.get(m.getName());
      if (answer != null) return answer.apply(args);
      if (m.getReturnType() == boolean.class) return false;
      if (m.getReturnType() == int.class) return 0;
      return null;
    });
  }

  private DataSource dataSource(PreparedStatement ps) {
    Connection conn = proxy(Connection.class, "conn", Map.of("prepareStatement", a -> ps));
    return proxy(DataSource.class, "ds", Map.of("getConnection", a -> conn));
  }

  @Test
  void updateBindsByPositionAndReleasesConnection() {
    PreparedStatement ps = proxy(PreparedStatement.class, "ps", Map.of("executeUpdate", a -> 1));
    DataSourceJdbcGateway gw = new DataSourceJdbcGateway(dataSource(ps));

    SqlParams p = new SqlParams();
    SqlStatement stmt = p.update("UPDATE \"Post\" SET \"title\" = " + p.add("t", FieldType.STRING)
        + ", \"author\" = " + p.add(null, FieldType.RELATION));
    List<Map<String, Object>> rows = gw.execute(stmt, null);

    assertTrue(rows.isEmpty());
    assertTrue(calls.contains("ps.setObject[1, t]"), calls.toString());
    assertTrue(calls.contains("ps.setNull[2, " + Types.BIGINT + "]"), calls.toString());
    assertTrue(calls.contains("ps.close"));
    assertEquals("conn.close", calls.get(calls.size() - 1));
  }

  @Test
  void queryReadsRowsByLabel() {
    int[] cursor = {0};
    Object[][] data = {{1, "a"}, {2, "b"}};
    ResultSetMetaData md = proxy(ResultSetMetaData.class, "md", Map.of(
        "getColumnCount", a -> 2,
        "getColumnLabel", a -> (int) a[0] == 1 ? "id" : "label"));
    ResultSet rs = proxy(ResultSet.class, "rs", Map.of(
        "getMetaData", a -> md,
        "next", a -> cursor[0]++ < data.length,
        "getObject", a -> data[cursor[0] - 1][(int) a[0] - 1]));
    PreparedStatement ps = proxy(PreparedStatement.class, "ps", Map.of("executeQuery", a -> rs));

    List<Map<String, Object>> rows = new DataSourceJdbcGateway(dataSource(ps))
        .execute(SqlParams.noParams("SELECT id, label FROM t", SqlStatement.ExecKind.QUERY), null);

    assertEquals(List.of(Map.of("id", 1, "label", "a"), Map.of("id", 2, "label", "b")), rows);
    assertEquals(List.of("id", "label"), List.copyOf(rows.get(0).keySet()));
  }

  @Test
  void unreachableDatabaseIsConnectionError() {
    DataSource failing = (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{DataSource.class},
        (p, m, args) -> {
          if (m.getName().equals("getConnection")) throw new SQLException("refused");
          return null;
        });
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> new DataSourceJdbcGateway(failing).execute(SqlParams.noParams("SELECT 1", SqlStatement.ExecKind.QUERY), null));
    assertEquals(ErrorKind.CONNECTION, ex.kind());
  }

  @Test
  void sqlExceptionBecomesSqlExecutionException() {
    Connection conn = (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class},
        (p, m, args) -> {
          if (m.getName().equals("prepareStatement")) throw new SQLException("bad column", "42S22");
          return null;
        });
    DataSource ds = proxy(DataSource.class, "ds", Map.of("getConnection", a -> conn));

    SqlExecutionException ex = assertThrows(SqlExecutionException.class,
        () -> new DataSourceJdbcGateway(ds).execute(SqlParams.noParams("SELECT nope FROM t", SqlStatement.ExecKind.QUERY), null));
    assertEquals("SELECT nope FROM t", ex.sql());
    assertTrue(ex.getMessage().contains("42S22"));
  }

  @Test
  void beginTurnsOffAutoCommitAndRejectsForeignTransactions() {
    PreparedStatement ps = proxy(PreparedStatement.class, "ps", Map.of());
    DataSourceJdbcGateway gw = new DataSourceJdbcGateway(dataSource(ps));

    Transaction tx = gw.begin();
    assertTrue(tx instanceof JdbcTransaction);
    assertTrue(calls.contains("conn.setAutoCommit[false]"), calls.toString());

    Transaction foreign = new RecordingGateway().begin();
    assertThrows(IllegalArgumentException.class,
        () -> gw.execute(SqlParams.noParams("SELECT 1", SqlStatement.ExecKind.QUERY), foreign));
  }
}
