package io.intellixity.relata.persistence.schema;

import java.util.Objects;

/**
 * Relation metadata of a {@link FieldType#RELATION} field.
 *
 * @param targetEntity related entity name
 * @param kind storage/resolution strategy
 * @param weak related rows are owned by this side (inserted and deleted with it)
 */
public record RelationDef(String targetEntity, RelationKind kind, boolean weak) {
  public RelationDef {
    Objects.requireNonNull(targetEntity, "targetEntity");
    Objects.requireNonNull(kind, "kind");
  }

  public static RelationDef of(String targetEntity, RelationKind kind) {
    return new RelationDef(targetEntity, kind, false);
  }

  public static RelationDef weak(String targetEntity, RelationKind kind) {
    return new RelationDef(targetEntity, kind, true);
  }
}
