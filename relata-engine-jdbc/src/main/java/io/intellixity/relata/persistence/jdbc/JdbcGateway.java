package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.exec.Transaction;

import java.util.List;
import java.util.Map;

/** Single point through which every SQL statement reaches the database. */
public interface JdbcGateway {
  /**
   * Runs {@code stmt} inside {@code txOrNull}, or on a pooled connection in auto-commit mode when null.
   *
   * @return result rows keyed by column label (generated keys for {@code UPDATE_GENERATED_KEYS}, empty for {@code UPDATE})
   */
  List<Map<String, Object>> execute(SqlStatement stmt, Transaction txOrNull);

  Transaction begin();
}
