package io.intellixity.relata.persistence.schema;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Read-only view over the registered entity schemas. */
public interface SchemaRegistry {
  /** @throws IllegalArgumentException for unknown entities */
  EntitySchema getSchema(String entity);

  Collection<String> entityNames();

  default Map<String, FieldDef> getFields(String entity) {
    return getSchema(entity).fields();
  }

  default List<String> getFieldNames(String entity) {
    return List.copyOf(getSchema(entity).fields().keySet());
  }

  /** Null when the field is not declared. */
  default FieldDef getField(String entity, String field) {
    return getSchema(entity).field(field);
  }

  String primaryKeyField(String entity);
}
