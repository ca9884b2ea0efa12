package io.intellixity.relata.persistence.jdbc.config;

import java.util.Objects;
import java.util.Properties;

/**
 * Connection and pool settings.
 *
 * @param port 0 selects the dialect's default port
 * @param jdbcUrl explicit URL; when null the dialect derives one from host, port and database
 */
public record DatabaseConfig(String dialect,
                             String host,
                             int port,
                             String user,
                             String password,
                             String database,
                             int poolMin,
                             int poolMax,
                             long idleTimeoutMillis,
                             long connectionTimeoutMillis,
                             String jdbcUrl) {
  public static final String DEFAULT_PREFIX = "relata.db.";
  public static final long DEFAULT_IDLE_TIMEOUT_MS = 10_000;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000;

  public DatabaseConfig {
    Objects.requireNonNull(dialect, "dialect");
    if (jdbcUrl == null && (database == null || database.isBlank())) {
      throw new IllegalArgumentException("database is required when no jdbcUrl is given");
    }
    host = (host == null || host.isBlank()) ? "localhost" : host;
    if (port < 0) throw new IllegalArgumentException("port must be >= 0");
    if (poolMax <= 0) throw new IllegalArgumentException("poolMax must be > 0");
    if (poolMin < 0 || poolMin > poolMax) throw new IllegalArgumentException("poolMin must be in [0, poolMax]");
    idleTimeoutMillis = idleTimeoutMillis <= 0 ? DEFAULT_IDLE_TIMEOUT_MS : idleTimeoutMillis;
    connectionTimeoutMillis = connectionTimeoutMillis <= 0 ? DEFAULT_CONNECTION_TIMEOUT_MS : connectionTimeoutMillis;
  }

  public static DatabaseConfig fromProperties(Properties p) {
    return fromProperties(p, DEFAULT_PREFIX);
  }

  /**
   * Reads {@code <prefix>dialect, host, port, user, password, database, url,
   * pool.min, pool.max, pool.idleTimeoutMs, pool.connectionTimeoutMs}.
   */
  public static DatabaseConfig fromProperties(Properties p, String prefix) {
    return new DatabaseConfig(
        p.getProperty(prefix + "dialect", "mssql"),
        p.getProperty(prefix + "host"),
        intProp(p, prefix + "port", 0),
        p.getProperty(prefix + "user"),
        p.getProperty(prefix + "password"),
        p.getProperty(prefix + "database"),
        intProp(p, prefix + "pool.min", 0),
        intProp(p, prefix + "pool.max", 10),
        longProp(p, prefix + "pool.idleTimeoutMs", DEFAULT_IDLE_TIMEOUT_MS),
        longProp(p, prefix + "pool.connectionTimeoutMs", DEFAULT_CONNECTION_TIMEOUT_MS),
        p.getProperty(prefix + "url"));
  }

  /** {@code port} when set, else {@code fallback}. */
  public int portOr(int fallback) {
    return port == 0 ? fallback : port;
  }

  @Override
  public String toString() {
    // password stays out of logs
    return "DatabaseConfig{dialect=" + dialect + ", host=" + host + ", port=" + port + ", user=" + user
        + ", database=" + database + ", pool=" + poolMin + ".." + poolMax + "}";
  }

  private static int intProp(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + v, e);
    }
  }

  private static long longProp(Properties p, String key, long def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Long.parseLong(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not a number: " + v, e);
    }
  }
}
