package io.intellixity.relata.persistence.query;

import java.util.Objects;

/**
 * Joins {@code query.entity()} on {@code <alias>.<field> = <joined>.<pk>}.
 * The nested query contributes its fields, filter, sort and own joins.
 */
public record Join(JoinKind kind, String field, Query query) {
  public Join {
    kind = kind == null ? JoinKind.LEFT : kind;
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(query, "query");
  }

  public static Join left(String field, Query query) { return new Join(JoinKind.LEFT, field, query); }
  public static Join inner(String field, Query query) { return new Join(JoinKind.INNER, field, query); }
}
