package io.intellixity.relata.persistence.util;

/** Identifier casing helpers used for derived table and column names. */
public final class Names {
  private Names() {}

  /** {@code BlogPost -> blogPost}. */
  public static String camel(String s) {
    if (s == null || s.isEmpty()) return s;
    return Character.toLowerCase(s.charAt(0)) + s.substring(1);
  }

  /** {@code tags -> Tags}. */
  public static String pascal(String s) {
    if (s == null || s.isEmpty()) return s;
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
