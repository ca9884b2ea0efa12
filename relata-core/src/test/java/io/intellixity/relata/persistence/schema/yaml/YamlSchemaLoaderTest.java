package io.intellixity.relata.persistence.schema.yaml;

import io.intellixity.relata.persistence.schema.*;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class YamlSchemaLoaderTest {
  @Test
  void loadsEntitiesFieldsAndRelations() {
    InMemorySchemaRegistry reg = YamlSchemaLoader.loadResource("schemas/blog.yaml");

    assertEquals(List.of("Post", "User", "Tag", "Image"), List.copyOf(reg.entityNames()));
    assertEquals("id", reg.primaryKeyField("Post"));

    FieldDef title = reg.getField("Post", "title");
    assertEquals(FieldType.STRING, title.type());
    assertEquals(120, title.maxLength());
    assertTrue(title.required());

    FieldDef tags = reg.getField("Post", "tags");
    assertEquals(new RelationDef("Tag", RelationKind.MANY_TO_MANY, false), tags.relation());

    FieldDef cover = reg.getField("Post", "cover");
    assertTrue(cover.relation().weak());
    assertEquals(RelationKind.ONE_TO_ONE, cover.relation().kind());

    FieldDef keywords = reg.getField("Post", "keywords");
    assertEquals(FieldType.LIST, keywords.type());
    assertEquals(FieldType.STRING, keywords.listElementType());

    assertEquals(Boolean.FALSE, reg.getField("Post", "published").defaultValue());
    assertEquals(FieldType.TEXT, reg.getField("Post", "body").type());
    assertTrue(reg.getField("Tag", "label").multilingual());
    assertEquals(RelationKind.REVERSE, reg.getField("User", "posts").relation().kind());
  }

  @Test
  void rejectsUnknownType() {
    String yaml = """
        entities:
          - name: A
            fields:
              x: { type: decimalish }
        """;
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlSchemaLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline"));
    assertTrue(ex.getMessage().contains("decimalish"));
  }

  @Test
  void typeDslParsesListsAndRelations() {
    FieldTypeParser.Parsed list = FieldTypeParser.parse("list<integer>");
    assertEquals(FieldType.LIST, list.type());
    assertEquals(FieldType.INTEGER, list.listElementType());

    FieldTypeParser.Parsed rel = FieldTypeParser.parse("many-to-many( Tag )");
    assertEquals(FieldType.RELATION, rel.type());
    assertEquals(new RelationDef("Tag", RelationKind.MANY_TO_MANY, true), rel.relation(true));

    assertNull(FieldTypeParser.parse("email").relation(false));
  }
}
