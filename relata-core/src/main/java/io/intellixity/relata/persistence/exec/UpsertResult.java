package io.intellixity.relata.persistence.exec;

import java.util.List;
import java.util.Map;

/** Rows as stored after an insert, update or increase. */
public record UpsertResult(List<Map<String, Object>> items) {
  public UpsertResult {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static UpsertResult empty() { return new UpsertResult(List.of()); }

  public Map<String, Object> first() { return items.isEmpty() ? null : items.get(0); }
}
