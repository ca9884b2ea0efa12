package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link Query}. */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseQuery(root, codec);
  }

  private static Query parseQuery(JsonNode root, ObjectCodec codec) throws IOException {
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");
    String entity = textOrNull(root.get("entity"));
    if (entity == null) throw new IllegalArgumentException("Query JSON requires entity");

    Query q = new Query(entity);

    JsonNode fields = root.get("fields");
    if (fields != null && fields.isArray()) {
      List<Selection> out = new ArrayList<>();
      for (JsonNode f : fields) {
        if (f.isTextual()) out.add(Selection.column(f.asText()));
        else if (f.isObject() && f.has("query")) out.add(Selection.subQuery(parseQuery(f.get("query"), codec)));
      }
      q.withSelections(out);
    }

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> out = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = SortField.Direction.parse(dir);
        out.add(new SortField(f, d));
      }
      q.withSort(out);
    }

    q.withLimit(intOrDefault(root.get("limit"), 0));
    q.withOffset(intOrDefault(root.get("offset"), 0));
    q.withPage(intOrDefault(root.get("page"), 0));

    JsonNode relations = root.get("relations");
    if (relations != null && relations.isArray()) {
      List<RelationRequest> out = new ArrayList<>();
      for (JsonNode r : relations) {
        if (r.isTextual()) {
          out.add(RelationRequest.of(r.asText()));
        } else if (r.isObject()) {
          List<String> rf = new ArrayList<>();
          JsonNode fs = r.get("fields");
          if (fs != null && fs.isArray()) for (JsonNode x : fs) if (x.isTextual()) rf.add(x.asText());
          out.add(new RelationRequest(textOrNull(r.get("name")), rf));
        }
      }
      q.withRelations(out);
    }

    JsonNode joins = root.get("joins");
    if (joins != null && joins.isArray()) {
      List<Join> out = new ArrayList<>();
      for (JsonNode j : joins) {
        out.add(new Join(JoinKind.parse(textOrNull(j.get("kind"))), textOrNull(j.get("field")),
            parseQuery(j.get("query"), codec)));
      }
      q.withJoins(out);
    }

    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.isObject() && n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.isObject() && n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // Canonical condition form: { "eq": { field:..., value:..., valueIsField?:..., entity?:... } }
    if (n.isObject()) {
      Iterator<String> it = n.fieldNames();
      while (it.hasNext()) {
        String k = it.next();
        Operator op = tryOp(k);
        if (op == null) continue;
        JsonNode body = n.get(k);
        if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
        String field = textOrNull(body.get("field"));
        if (field == null) throw new IllegalArgumentException(op + " requires field");
        JsonNode v = body.get("value");
        Object value = (v == null || v.isNull()) ? null : codec.treeToValue(v, Object.class);
        boolean valueIsField = body.path("valueIsField").asBoolean(false);
        return new Condition(field, op, value, valueIsField, textOrNull(body.get("entity")));
      }
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    try {
      return Operator.valueOf(key.toUpperCase());
    } catch (Exception e) {
      return null;
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }
}
