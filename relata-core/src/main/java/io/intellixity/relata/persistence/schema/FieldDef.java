package io.intellixity.relata.persistence.schema;

import java.util.Objects;

/**
 * Field descriptor.
 *
 * <p>{@code maxLength} bounds string-like columns, {@code max} is a precision hint for numeric columns.
 * {@code listElementType} is set for {@link FieldType#LIST} fields, {@code relation} for {@link FieldType#RELATION}.</p>
 */
public record FieldDef(String name,
                       FieldType type,
                       boolean required,
                       boolean unique,
                       Object defaultValue,
                       Integer maxLength,
                       Long max,
                       boolean primary,
                       boolean multilingual,
                       FieldType listElementType,
                       RelationDef relation) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (type == FieldType.RELATION && relation == null) {
      throw new IllegalArgumentException("Relation field '" + name + "' has no relation definition");
    }
    if (type != FieldType.RELATION && relation != null) {
      throw new IllegalArgumentException("Field '" + name + "' of type " + type + " cannot declare a relation");
    }
    if (type == FieldType.LIST && listElementType == null) listElementType = FieldType.STRING;
    if (listElementType == FieldType.LIST || listElementType == FieldType.RELATION) {
      throw new IllegalArgumentException("List field '" + name + "' must hold scalars, got " + listElementType);
    }
  }

  public static Builder builder(String name, FieldType type) { return new Builder(name, type); }

  public boolean isRelation() { return relation != null; }
  public boolean isList() { return type == FieldType.LIST; }
  public boolean isObject() { return type == FieldType.OBJECT; }

  /** Relation of the given kind, else false. */
  public boolean isRelation(RelationKind kind) { return relation != null && relation.kind() == kind; }

  /** True when the field owns a physical column on the entity table. */
  public boolean hasColumn() {
    if (type == FieldType.LIST) return false;
    return relation == null || relation.kind().hasForeignKey();
  }

  public static final class Builder {
    private final String name;
    private final FieldType type;
    private boolean required;
    private boolean unique;
    private Object defaultValue;
    private Integer maxLength;
    private Long max;
    private boolean primary;
    private boolean multilingual;
    private FieldType listElementType;
    private RelationDef relation;

    private Builder(String name, FieldType type) {
      this.name = name;
      this.type = type;
    }

    public Builder required() { this.required = true; return this; }
    public Builder required(boolean v) { this.required = v; return this; }
    public Builder unique() { this.unique = true; return this; }
    public Builder unique(boolean v) { this.unique = v; return this; }
    public Builder defaultValue(Object v) { this.defaultValue = v; return this; }
    public Builder maxLength(Integer v) { this.maxLength = v; return this; }
    public Builder max(Long v) { this.max = v; return this; }
    public Builder primary() { this.primary = true; return this; }
    public Builder primary(boolean v) { this.primary = v; return this; }
    public Builder multilingual() { this.multilingual = true; return this; }
    public Builder multilingual(boolean v) { this.multilingual = v; return this; }
    public Builder listOf(FieldType v) { this.listElementType = v; return this; }
    public Builder relation(RelationDef v) { this.relation = v; return this; }

    public FieldDef build() {
      return new FieldDef(name, type, required, unique, defaultValue, maxLength, max,
          primary, multilingual, listElementType, relation);
    }
  }
}
