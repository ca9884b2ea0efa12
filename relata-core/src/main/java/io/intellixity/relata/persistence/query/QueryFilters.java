package io.intellixity.relata.persistence.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String field, Object value) { return Condition.of(field, Operator.EQ, value); }
  public static Condition ne(String field, Object value) { return Condition.of(field, Operator.NE, value); }
  public static Condition gt(String field, Object value) { return Condition.of(field, Operator.GT, value); }
  public static Condition ge(String field, Object value) { return Condition.of(field, Operator.GE, value); }
  public static Condition lt(String field, Object value) { return Condition.of(field, Operator.LT, value); }
  public static Condition le(String field, Object value) { return Condition.of(field, Operator.LE, value); }
  public static Condition like(String field, Object value) { return Condition.of(field, Operator.LIKE, value); }
  public static Condition notLike(String field, Object value) { return Condition.of(field, Operator.NOT_LIKE, value); }

  /** Column-to-column comparison, e.g. {@code updatedAt > createdAt}. */
  public static Condition compareFields(String field, Operator op, String otherField) {
    return Condition.fieldRef(field, op, otherField);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  /** AND of equality conditions over the non-null entries, in map order. */
  public static LogicalGroup allEqual(Map<String, ?> values) {
    List<QueryElement> out = new ArrayList<>();
    for (var e : values.entrySet()) {
      if (e.getValue() != null) out.add(eq(e.getKey(), e.getValue()));
    }
    return new LogicalGroup(Clause.AND, out);
  }
}
