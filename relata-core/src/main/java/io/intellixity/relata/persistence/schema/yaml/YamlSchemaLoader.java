package io.intellixity.relata.persistence.schema.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.InMemorySchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads entity schemas from YAML.
 *
 * <pre>{@code
 * entities:
 *   - name: Post
 *     fields:
 *       id:    { type: integer, primary: true }
 *       title: { type: string, maxLength: 120, required: true }
 *       tags:  { type: many-to-many(Tag) }
 *       keywords: { type: list<string> }
 * }</pre>
 */
public final class YamlSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  private YamlSchemaLoader() {}

  public static InMemorySchemaRegistry load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema file " + path, e);
    }
  }

  public static InMemorySchemaRegistry loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlSchemaLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Schema resource not found: " + resource);
      return load(in, resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema resource " + resource, e);
    }
  }

  public static InMemorySchemaRegistry load(InputStream in, String origin) {
    JsonNode root;
    try {
      root = YAML.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Invalid schema YAML in " + origin, e);
    }
    if (root == null || !root.path("entities").isArray()) {
      throw new IllegalArgumentException("Schema YAML must have an 'entities' list: " + origin);
    }

    List<EntitySchema> out = new ArrayList<>();
    for (JsonNode e : root.get("entities")) {
      out.add(parseEntity(e, origin));
    }
    log.debug("relata.schema origin={} entities={}", origin, out.size());
    return new InMemorySchemaRegistry(out);
  }

  private static EntitySchema parseEntity(JsonNode e, String origin) {
    String name = text(e, "name");
    if (name == null) throw new IllegalArgumentException("Entity without name in " + origin);
    JsonNode fields = e.get("fields");
    if (fields == null || !fields.isObject()) {
      throw new IllegalArgumentException("Entity '" + name + "' has no fields in " + origin);
    }

    List<FieldDef> defs = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> f = it.next();
      defs.add(parseField(name, f.getKey(), f.getValue()));
    }
    return new EntitySchema(name, defs);
  }

  private static FieldDef parseField(String entity, String name, JsonNode n) {
    // Shorthand: `title: string`
    String typeText = n.isTextual() ? n.asText() : text(n, "type");
    if (typeText == null) throw new IllegalArgumentException("Field '" + entity + "." + name + "' has no type");

    FieldTypeParser.Parsed t = FieldTypeParser.parse(typeText);
    FieldDef.Builder b = FieldDef.builder(name, t.type())
        .required(n.path("required").asBoolean(false))
        .unique(n.path("unique").asBoolean(false))
        .primary(n.path("primary").asBoolean(false))
        .multilingual(n.path("multilingual").asBoolean(false))
        .listOf(t.listElementType())
        .relation(t.relation(n.path("weak").asBoolean(false)));

    if (n.hasNonNull("maxLength")) b.maxLength(n.get("maxLength").asInt());
    if (n.hasNonNull("max")) b.max(n.get("max").asLong());
    if (n.has("default")) b.defaultValue(YAML.convertValue(n.get("default"), Object.class));
    return b.build();
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }
}
