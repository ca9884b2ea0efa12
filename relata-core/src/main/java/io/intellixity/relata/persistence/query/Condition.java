package io.intellixity.relata.persistence.query;

import java.util.Objects;

/**
 * Leaf comparison {@code field <op> value}.
 *
 * <p>With {@code valueIsField} the value names another column of the same alias instead of a literal.
 * {@code entity} overrides the entity used to validate {@code field}.</p>
 */
public final class Condition implements QueryElement {
  private final String field;
  private final Operator operator;
  private final Object value;
  private final boolean valueIsField;
  private final String entity;

  public Condition(String field, Operator operator, Object value, boolean valueIsField, String entity) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.valueIsField = valueIsField;
    this.entity = entity;
    if (valueIsField && !(value instanceof String)) {
      throw new IllegalArgumentException("Field reference for '" + field + "' must be a field name");
    }
  }

  public String field() { return field; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public boolean valueIsField() { return valueIsField; }
  public String entity() { return entity; }

  public Condition withEntity(String entity) {
    return new Condition(field, operator, value, valueIsField, entity);
  }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator, value, false, null);
  }

  public static Condition fieldRef(String field, Operator operator, String otherField) {
    return new Condition(field, operator, otherField, true, null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return valueIsField == c.valueIsField && field.equals(c.field) && operator == c.operator
        && Objects.equals(value, c.value) && Objects.equals(entity, c.entity);
  }

  @Override
  public int hashCode() { return Objects.hash(field, operator, value, valueIsField, entity); }

  @Override
  public String toString() {
    return "Condition{" + field + " " + operator + " " + (valueIsField ? "@" : "") + value + "}";
  }
}
