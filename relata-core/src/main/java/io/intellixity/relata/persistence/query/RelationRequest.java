package io.intellixity.relata.persistence.query;

import java.util.List;
import java.util.Objects;

/** Relation to fetch; an empty {@code fields} list selects every field of the related entity. */
public record RelationRequest(String name, List<String> fields) {
  public RelationRequest {
    Objects.requireNonNull(name, "name");
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public static RelationRequest of(String name) { return new RelationRequest(name, List.of()); }

  public static RelationRequest of(String name, String... fields) { return new RelationRequest(name, List.of(fields)); }
}
