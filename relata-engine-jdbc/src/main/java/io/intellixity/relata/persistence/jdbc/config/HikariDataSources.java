package io.intellixity.relata.persistence.jdbc.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Builds the connection pool backing a JDBC engine. */
public final class HikariDataSources {
  private HikariDataSources() {}

  public static HikariConfig toHikariConfig(DatabaseConfig cfg, String jdbcUrl) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("relata-" + (cfg.database() == null ? cfg.dialect() : cfg.database()));
    hc.setJdbcUrl(jdbcUrl);
    if (cfg.user() != null) hc.setUsername(cfg.user());
    if (cfg.password() != null) hc.setPassword(cfg.password());
    hc.setMinimumIdle(cfg.poolMin());
    hc.setMaximumPoolSize(cfg.poolMax());
    hc.setIdleTimeout(cfg.idleTimeoutMillis());
    hc.setConnectionTimeout(cfg.connectionTimeoutMillis());
    return hc;
  }

  /** Starts the pool; Hikari opens its first connection eagerly. */
  public static HikariDataSource create(DatabaseConfig cfg, String jdbcUrl) {
    return new HikariDataSource(toHikariConfig(cfg, jdbcUrl));
  }
}
