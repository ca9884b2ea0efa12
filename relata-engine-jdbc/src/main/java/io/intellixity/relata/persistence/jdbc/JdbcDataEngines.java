package io.intellixity.relata.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.relata.persistence.jdbc.config.DatabaseConfig;
import io.intellixity.relata.persistence.jdbc.config.HikariDataSources;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialects;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ForkJoinPool;

/** Wires a pooled {@link JdbcDataEngine} from configuration. */
public final class JdbcDataEngines {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataEngines.class);

  private JdbcDataEngines() {}

  /** Closing the returned engine closes its pool. */
  public static JdbcDataEngine create(DatabaseConfig config, SchemaRegistry schemas) {
    JdbcDialect dialect = JdbcDialects.forId(config.dialect());
    String url = config.jdbcUrl() != null ? config.jdbcUrl() : dialect.jdbcUrl(config);
    HikariDataSource ds = HikariDataSources.create(config, url);
    log.info("relata.engine dialect={} pool={} entities={}", dialect.id(), ds.getPoolName(), schemas.entityNames().size());
    return new JdbcDataEngine(new DataSourceJdbcGateway(ds), dialect, schemas,
        ForkJoinPool.commonPool(), new ObjectMapper(), ds);
  }
}
