package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.ErrorKind;
import io.intellixity.relata.persistence.exec.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** {@link JdbcGateway} over a pooled {@link DataSource}. */
public final class DataSourceJdbcGateway implements JdbcGateway {
  private static final Logger log = LoggerFactory.getLogger(DataSourceJdbcGateway.class);

  private final DataSource ds;

  public DataSourceJdbcGateway(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public Transaction begin() {
    Connection c = connection();
    try {
      c.setAutoCommit(false);
      return new JdbcTransaction(c);
    } catch (SQLException e) {
      closeQuietly(c);
      throw new DatabaseException(ErrorKind.CONNECTION, "Failed to start transaction: " + e.getMessage(), e);
    }
  }

  @Override
  public List<Map<String, Object>> execute(SqlStatement stmt, Transaction txOrNull) {
    if (txOrNull == null) {
      Connection c = connection();
      try {
        return run(c, stmt);
      } finally {
        closeQuietly(c);
      }
    }
    if (!(txOrNull instanceof JdbcTransaction jt)) {
      throw new IllegalArgumentException("Transaction was not started by a JDBC engine: " + txOrNull.getClass().getName());
    }
    synchronized (jt) {
      return run(jt.connection(), stmt);
    }
  }

  private List<Map<String, Object>> run(Connection c, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql(ss);
    try {
      return switch (ss.execKind()) {
        case QUERY -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
            JdbcBinds.bindAll(ps, ss.binds());
            try (ResultSet rs = ps.executeQuery()) {
              List<Map<String, Object>> rows = JdbcRows.readAll(rs);
              debugDone(ss, rows.size(), System.nanoTime() - start);
              yield rows;
            }
          }
        }
        case UPDATE -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
            JdbcBinds.bindAll(ps, ss.binds());
            int n = ps.executeUpdate();
            debugDone(ss, n, System.nanoTime() - start);
            yield List.of();
          }
        }
        case UPDATE_GENERATED_KEYS -> {
          try (PreparedStatement ps = c.prepareStatement(ss.sql(), Statement.RETURN_GENERATED_KEYS)) {
            JdbcBinds.bindAll(ps, ss.binds());
            int n = ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
              List<Map<String, Object>> keys = JdbcRows.readAll(rs);
              debugDone(ss, n, System.nanoTime() - start);
              yield keys;
            }
          }
        }
      };
    } catch (SQLException e) {
      throw new SqlExecutionException(ss.sql(), e);
    }
  }

  private Connection connection() {
    try {
      return ds.getConnection();
    } catch (SQLException e) {
      throw new DatabaseException(ErrorKind.CONNECTION, "Failed to obtain connection: " + e.getMessage(), e);
    }
  }

  private static void closeQuietly(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("relata.jdbc connection close failed: {}", e.getMessage());
    }
  }

  private static void debugSql(SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc execKind={} bindCount={} sql={}", ss.execKind(), ss.bindCount(), ss.sql());

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("relata.jdbc bind index={} type={} valueType={} valueLen={}",
            idx++, b.type(), v == null ? "null" : v.getClass().getName(),
            v instanceof CharSequence cs ? cs.length() : -1);
      }
    }
  }

  private static void debugDone(SqlStatement ss, int result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.jdbc_done execKind={} durationMs={} result={}",
        ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
