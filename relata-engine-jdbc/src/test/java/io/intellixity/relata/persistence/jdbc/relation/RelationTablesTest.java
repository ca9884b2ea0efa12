package io.intellixity.relata.persistence.jdbc.relation;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RelationTablesTest {
  @Test
  void sideTableNames() {
    assertEquals("PostHasTags", RelationTables.junction("Post", "tags"));
    assertEquals("PostKeywordsList", RelationTables.list("Post", "keywords"));
    assertEquals("Post_translation", RelationTables.translation("Post"));
  }

  @Test
  void selfReferenceDisambiguatesRelatedColumn() {
    assertEquals(new RelationTables.JunctionColumns("blogPost", "tag"), RelationTables.junctionColumns("BlogPost", "Tag"));
    assertEquals(new RelationTables.JunctionColumns("user", "userRelated"), RelationTables.junctionColumns("User", "User"));
  }

  @Test
  void keysCompareAcrossDriverBoxing() {
    assertEquals(Keys.normalize(7), Keys.normalize(7L));
    assertEquals(Keys.normalize(7L), Keys.normalize(new BigDecimal("7.00")));
    assertEquals(Keys.normalize(7L), Keys.normalize(BigInteger.valueOf(7)));
    assertEquals("k", Keys.normalize("k"));
    assertEquals(3, Keys.first(Map.of("GENERATED_KEYS", 3)));
    assertNull(Keys.first(Map.of()));
  }
}
