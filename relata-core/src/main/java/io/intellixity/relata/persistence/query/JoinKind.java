package io.intellixity.relata.persistence.query;

import java.util.Locale;

public enum JoinKind {
  FULL("FULL OUTER JOIN"),
  LEFT("LEFT JOIN"),
  RIGHT("RIGHT JOIN"),
  INNER("INNER JOIN");

  private final String keyword;

  JoinKind(String keyword) { this.keyword = keyword; }

  public String keyword() { return keyword; }

  /** Unrecognized or missing kinds fall back to {@link #LEFT}. */
  public static JoinKind parse(String s) {
    if (s == null) return LEFT;
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return LEFT;
    }
  }
}
