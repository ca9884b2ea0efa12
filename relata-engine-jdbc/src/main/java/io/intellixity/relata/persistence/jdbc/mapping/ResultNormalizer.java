package io.intellixity.relata.persistence.jdbc.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.jdbc.compile.QueryParamCompiler;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns JSON-bearing string columns back into maps and lists.
 *
 * <ul>
 *   <li>{@code OBJECT} columns hold plain JSON</li>
 *   <li>embedded relation and sub-query columns hold {@code CONCAT}-built JSON using
 *   {@link QueryParamCompiler#QUOTE_MARKER} for quotes; they are un-escaped first</li>
 *   <li>columns the schema does not declare are parsed only when they look like JSON</li>
 * </ul>
 * Unparseable values are kept as the raw string.
 */
public final class ResultNormalizer {
  private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);

  private final SchemaRegistry schemas;
  private final ObjectMapper json;

  public ResultNormalizer(SchemaRegistry schemas, ObjectMapper json) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.json = Objects.requireNonNull(json, "json");
  }

  public List<Map<String, Object>> normalize(String entity, List<Map<String, Object>> rows) {
    EntitySchema s = schemas.getSchema(entity);
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (var e : row.entrySet()) m.put(e.getKey(), value(s.field(e.getKey()), e.getValue()));
      out.add(m);
    }
    return out;
  }

  private Object value(FieldDef f, Object v) {
    if (!(v instanceof String raw)) return v;
    boolean embedded = raw.contains(QueryParamCompiler.QUOTE_MARKER);
    if (f == null) {
      if (embedded) return parse(unescapeEmbedded(raw), raw);
      String t = raw.stripLeading();
      return (t.startsWith("{") || t.startsWith("[")) ? parse(raw, raw) : raw;
    }
    if (f.isObject()) return parse(raw, raw);
    if (f.isRelation() && embedded) return parse(unescapeEmbedded(raw), raw);
    return raw;
  }

  private Object parse(String text, String raw) {
    try {
      return json.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      if (log.isDebugEnabled()) log.debug("relata.normalize keeping raw value len={} reason={}", raw.length(), e.getOriginalMessage());
      return raw;
    }
  }

  /** Escapes what CONCAT copied verbatim, then restores the quote marker. */
  static String unescapeEmbedded(String raw) {
    return raw
        .replace("\\", "\\\\")
        .replace("\n", "\\n")
        .replace("\r", "\\r")
        .replace("\t", "\\t")
        .replace("\"", "”")
        .replace("'", "’")
        .replace(QueryParamCompiler.QUOTE_MARKER, "\"");
  }
}
