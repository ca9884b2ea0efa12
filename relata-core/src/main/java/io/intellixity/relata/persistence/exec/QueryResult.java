package io.intellixity.relata.persistence.exec;

import java.util.List;
import java.util.Map;

/** Rows of a find, or only {@code total} for a count. */
public record QueryResult(List<Map<String, Object>> items, long total) {
  public QueryResult {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static QueryResult of(List<Map<String, Object>> items) { return new QueryResult(items, items.size()); }

  public static QueryResult count(long total) { return new QueryResult(List.of(), total); }

  /** First row or null. */
  public Map<String, Object> first() { return items.isEmpty() ? null : items.get(0); }
}
