package io.intellixity.relata.persistence.jdbc;

import io.intellixity.relata.persistence.schema.FieldType;

/** Bound parameter value; {@code type} picks the SQL type used when the value is null. */
public record Bind(Object value, FieldType type) {
  public static Bind of(Object value) {
    return new Bind(value, infer(value));
  }

  private static FieldType infer(Object v) {
    if (v instanceof Boolean) return FieldType.BOOLEAN;
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) return FieldType.INTEGER;
    if (v instanceof Number) return FieldType.NUMBER;
    return FieldType.STRING;
  }
}
