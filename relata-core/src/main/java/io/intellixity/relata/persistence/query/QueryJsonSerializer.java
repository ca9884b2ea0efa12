package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Locale;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("entity", q.entity());

    if (!q.selections().isEmpty()) {
      g.writeArrayFieldStart("fields");
      for (Selection s : q.selections()) {
        if (s instanceof Selection.Column c) {
          g.writeString(c.field());
        } else if (s instanceof Selection.SubQuery sq) {
          g.writeStartObject();
          g.writeFieldName("query");
          serialize(sq.query(), g, serializers);
          g.writeEndObject();
        }
      }
      g.writeEndArray();
    }

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (!q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() > 0) g.writeNumberField("limit", q.limit());
    if (q.offset() > 0) g.writeNumberField("offset", q.offset());
    if (q.page() > 0) g.writeNumberField("page", q.page());

    if (!q.relations().isEmpty()) {
      g.writeArrayFieldStart("relations");
      for (RelationRequest r : q.relations()) {
        if (r.fields().isEmpty()) {
          g.writeString(r.name());
        } else {
          g.writeStartObject();
          g.writeStringField("name", r.name());
          g.writeObjectField("fields", r.fields());
          g.writeEndObject();
        }
      }
      g.writeEndArray();
    }

    if (!q.joins().isEmpty()) {
      g.writeArrayFieldStart("joins");
      for (Join j : q.joins()) {
        g.writeStartObject();
        g.writeStringField("kind", j.kind().name().toLowerCase(Locale.ROOT));
        g.writeStringField("field", j.field());
        g.writeFieldName("query");
        serialize(j.query(), g, serializers);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeArrayFieldStart(lg.clause() == Clause.OR ? "or" : "and");
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().name().toLowerCase(Locale.ROOT));
      g.writeStringField("field", c.field());
      g.writeFieldName("value");
      serializers.defaultSerializeValue(c.value(), g);
      if (c.valueIsField()) g.writeBooleanField("valueIsField", true);
      if (c.entity() != null) g.writeStringField("entity", c.entity());
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }
}
