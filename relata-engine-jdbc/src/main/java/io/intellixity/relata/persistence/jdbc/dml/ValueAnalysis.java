package io.intellixity.relata.persistence.jdbc.dml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.ErrorKind;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;

import java.util.*;

/**
 * Splits a value object by storage: entity-table columns, relation values and list values.
 *
 * <p>Keys the schema does not declare are ignored. A null primary key is dropped so the database generates it.
 * A null foreign-key relation stays a column (it clears the reference); other null relations are ignored.
 * {@code OBJECT} values are stored as JSON text.</p>
 */
final class ValueAnalysis {
  private ValueAnalysis() {}

  record Analysed(Map<String, Object> columns, Map<FieldDef, Object> relations, Map<FieldDef, List<Object>> lists) {}

  static Analysed analyse(EntitySchema s, Map<String, Object> value, ObjectMapper json) {
    Map<String, Object> columns = new LinkedHashMap<>();
    Map<FieldDef, Object> relations = new LinkedHashMap<>();
    Map<FieldDef, List<Object>> lists = new LinkedHashMap<>();

    for (FieldDef f : s.fields().values()) {
      if (!value.containsKey(f.name())) continue;
      Object v = value.get(f.name());

      if (f.isList()) {
        lists.put(f, toList(v));
      } else if (f.isRelation()) {
        if (v != null) relations.put(f, v);
        else if (f.relation().kind().hasForeignKey()) columns.put(f.name(), null);
      } else if (!(f.primary() && v == null)) {
        columns.put(f.name(), f.isObject() ? jsonText(s, f, v, json) : v);
      }
    }
    return new Analysed(columns, relations, lists);
  }

  static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return List.of(v);
  }

  private static Object jsonText(EntitySchema s, FieldDef f, Object v, ObjectMapper json) {
    if (v == null || v instanceof String) return v;
    try {
      return json.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new DatabaseException(ErrorKind.INVALID_INPUT,
          "Field " + s.name() + "." + f.name() + " is not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }
}
