package io.intellixity.relata.persistence.schema.yaml;

import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.schema.RelationDef;
import io.intellixity.relata.persistence.schema.RelationKind;

/**
 * Tiny type DSL for YAML schemas:
 * <pre>
 * string | integer | ...
 * list&lt;string&gt;
 * one-to-one(User) | one-to-many(User) | many-to-many(Tag) | reverse(Post)
 * </pre>
 */
final class FieldTypeParser {
  private FieldTypeParser() {}

  record Parsed(FieldType type, FieldType listElementType, RelationKind relationKind, String relationTarget) {
    RelationDef relation(boolean weak) {
      return relationKind == null ? null : new RelationDef(relationTarget, relationKind, weak);
    }
  }

  static Parsed parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    s = s.trim();

    if (s.startsWith("list<") && s.endsWith(">")) {
      FieldType element = FieldType.parse(s.substring(5, s.length() - 1));
      return new Parsed(FieldType.LIST, element, null, null);
    }

    int open = s.indexOf('(');
    if (open > 0 && s.endsWith(")")) {
      RelationKind kind = RelationKind.parse(s.substring(0, open));
      String target = s.substring(open + 1, s.length() - 1).trim();
      if (target.isEmpty()) throw new IllegalArgumentException("relation target is blank: " + s);
      return new Parsed(FieldType.RELATION, null, kind, target);
    }

    return new Parsed(FieldType.parse(s), null, null, null);
  }
}
