package io.intellixity.relata.persistence.schema;

import java.util.*;

/**
 * Registry backed by a fixed list of schemas.
 *
 * <p>Primary keys are resolved once here; relation targets must be registered too.</p>
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, EntitySchema> schemas = new LinkedHashMap<>();
  private final Map<String, String> primaryKeys = new HashMap<>();

  public InMemorySchemaRegistry(List<EntitySchema> entities) {
    for (EntitySchema s : entities) {
      if (schemas.put(s.name(), s) != null) {
        throw new IllegalArgumentException("Duplicate entity: " + s.name());
      }
      primaryKeys.put(s.name(), s.primaryKey());
    }
    for (EntitySchema s : schemas.values()) {
      for (FieldDef f : s.fields().values()) {
        if (f.isRelation() && !schemas.containsKey(f.relation().targetEntity())) {
          throw new IllegalArgumentException("Field '" + s.name() + "." + f.name()
              + "' references unknown entity '" + f.relation().targetEntity() + "'");
        }
      }
    }
  }

  public static InMemorySchemaRegistry of(EntitySchema... entities) {
    return new InMemorySchemaRegistry(List.of(entities));
  }

  @Override
  public EntitySchema getSchema(String entity) {
    EntitySchema s = schemas.get(entity);
    if (s == null) throw new IllegalArgumentException("Unknown entity: " + entity);
    return s;
  }

  @Override
  public Collection<String> entityNames() { return Collections.unmodifiableSet(schemas.keySet()); }

  @Override
  public String primaryKeyField(String entity) {
    String pk = primaryKeys.get(entity);
    if (pk == null) throw new IllegalArgumentException("Unknown entity: " + entity);
    return pk;
  }
}
