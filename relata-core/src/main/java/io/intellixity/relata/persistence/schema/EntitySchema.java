package io.intellixity.relata.persistence.schema;

import java.util.*;

/** Entity name plus its fields in declaration order. */
public final class EntitySchema {
  private final String name;
  private final Map<String, FieldDef> fields;

  public EntitySchema(String name, List<FieldDef> fields) {
    this.name = Objects.requireNonNull(name, "name");
    Map<String, FieldDef> m = new LinkedHashMap<>();
    for (FieldDef f : Objects.requireNonNull(fields, "fields")) {
      if (m.put(f.name(), f) != null) {
        throw new IllegalArgumentException("Duplicate field '" + f.name() + "' in entity '" + name + "'");
      }
    }
    this.fields = Collections.unmodifiableMap(m);
  }

  public static EntitySchema of(String name, FieldDef... fields) {
    return new EntitySchema(name, List.of(fields));
  }

  public String name() { return name; }
  public Map<String, FieldDef> fields() { return fields; }
  public FieldDef field(String name) { return fields.get(name); }

  /** Name of the field flagged primary, or {@code "id"} when none is. */
  public String primaryKey() {
    for (FieldDef f : fields.values()) {
      if (f.primary()) return f.name();
    }
    return "id";
  }

  @Override
  public String toString() {
    return "EntitySchema{" + name + ", fields=" + fields.keySet() + "}";
  }
}
