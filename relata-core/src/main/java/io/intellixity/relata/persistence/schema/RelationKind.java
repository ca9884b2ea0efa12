package io.intellixity.relata.persistence.schema;

import java.util.Locale;

public enum RelationKind {
  /** Foreign-key column on the owning table. */
  ONE_TO_ONE,
  /** Foreign-key column on the owning table; same storage as {@link #ONE_TO_ONE}. */
  ONE_TO_MANY,
  /** Junction table {@code <Owner>Has<Field>}. */
  MANY_TO_MANY,
  /** Inverse side of a relation declared on the related entity; no physical column. */
  REVERSE;

  /** True for kinds stored as a foreign-key column on the owner. */
  public boolean hasForeignKey() {
    return switch (this) {
      case ONE_TO_ONE, ONE_TO_MANY -> true;
      case MANY_TO_MANY, REVERSE -> false;
    };
  }

  /** Accepts {@code one-to-many}, {@code ONE_TO_MANY} and {@code oneToMany}. */
  public static RelationKind parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("relation kind is blank");
    String norm = s.trim()
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('-', '_')
        .toUpperCase(Locale.ROOT);
    try {
      return valueOf(norm);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown relation kind: " + s, e);
    }
  }
}
