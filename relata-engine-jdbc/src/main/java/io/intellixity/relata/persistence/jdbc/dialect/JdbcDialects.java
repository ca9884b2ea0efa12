package io.intellixity.relata.persistence.jdbc.dialect;

import io.intellixity.relata.persistence.util.RelataFactoriesLoader;

import java.util.ArrayList;
import java.util.List;

/** Looks up {@link JdbcDialect} implementations registered in {@code META-INF/relata.factories}. */
public final class JdbcDialects {
  private JdbcDialects() {}

  public static List<JdbcDialect> available() {
    return RelataFactoriesLoader.load(JdbcDialect.class);
  }

  /** @throws IllegalArgumentException when no registered dialect has this id */
  public static JdbcDialect forId(String id) {
    List<String> ids = new ArrayList<>();
    for (JdbcDialect d : available()) {
      if (d.id().equalsIgnoreCase(id)) return d;
      ids.add(d.id());
    }
    throw new IllegalArgumentException("Unknown dialect '" + id + "', available: " + ids);
  }
}
