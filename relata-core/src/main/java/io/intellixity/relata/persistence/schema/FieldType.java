package io.intellixity.relata.persistence.schema;

import java.util.Locale;

/** Semantic field types understood by the schema model and the SQL compilers. */
public enum FieldType {
  STRING,
  EMAIL,
  PASSWORD,
  TEL,
  URL,
  FILE,
  NUMBER,
  FLOAT,
  INTEGER,
  BOOLEAN,
  ENUM,
  TIMESTAMP,
  TEXT,
  OBJECT,
  LIST,
  RELATION;

  public boolean isStringLike() {
    return switch (this) {
      case STRING, EMAIL, PASSWORD, TEL, URL, FILE -> true;
      default -> false;
    };
  }

  public boolean isNumeric() {
    return switch (this) {
      case NUMBER, FLOAT, INTEGER, ENUM, TIMESTAMP -> true;
      default -> false;
    };
  }

  public static FieldType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("field type is blank");
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown field type: " + s, e);
    }
  }
}
