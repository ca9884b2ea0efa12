package io.intellixity.relata.persistence.query;

import java.util.Locale;
import java.util.Objects;

/** One ORDER BY key; a missing direction sorts ascending. */
public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("sort field must not be blank");
    if (direction == null) direction = Direction.ASC;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public boolean descending() { return direction == Direction.DESC; }

  public enum Direction {
    ASC, DESC;

    /** Case-insensitive; null or blank is ASC. */
    public static Direction parse(String s) {
      return (s == null || s.isBlank()) ? ASC : valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
  }
}
