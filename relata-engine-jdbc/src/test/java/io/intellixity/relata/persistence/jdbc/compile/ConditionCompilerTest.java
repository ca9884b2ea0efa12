package io.intellixity.relata.persistence.jdbc.compile;

import io.intellixity.relata.persistence.jdbc.AnsiTestDialect;
import io.intellixity.relata.persistence.jdbc.BlogSchemas;
import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.query.Operator;
import io.intellixity.relata.persistence.query.QueryFilters;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class ConditionCompilerTest {
  private final ConditionCompiler compiler = new ConditionCompiler(BlogSchemas.registry(), new AnsiTestDialect());

  @Test
  void emptyOrBranchIsDropped() {
    SqlParams p = new SqlParams();
    String sql = compiler.compile("Post", and(eq("status", "open"), or()), "Post", p);

    assertEquals("(\"Post\".\"status\" = :b1)", sql);
    assertEquals("open", p.asMap().get("b1").value());
  }

  @Test
  void emptyGroupsCompileToNothing() {
    SqlParams p = new SqlParams();
    assertEquals("", compiler.compile("Post", and(), "Post", p));
    assertEquals("", compiler.compile("Post", or(and(), or()), "Post", p));
    assertEquals("", compiler.compile("Post", null, "Post", p));
    assertTrue(p.asMap().isEmpty());
  }

  @Test
  void groupsJoinSurvivorsWithTheirConnector() {
    String sql = compiler.compile("Post",
        or(eq("status", "open"), and(gt("views", 10), le("views", 20))), "p", new SqlParams());

    assertEquals("((\"p\".\"status\" = :b1) OR ((\"p\".\"views\" > :b2) AND (\"p\".\"views\" <= :b3)))", sql);
  }

  @Test
  void undeclaredAndColumnlessFieldsAreSkipped() {
    SqlParams p = new SqlParams();
    assertEquals("", compiler.compile("Post", eq("ghost", 1), "Post", p));
    assertEquals("", compiler.compile("Post", eq("tags", 1), "Post", p));
    assertEquals("(\"Post\".\"title\" LIKE :b1)",
        compiler.compile("Post", and(eq("keywords", "x"), like("title", "%a%")), "Post", p));
  }

  @Test
  void fieldComparisonUsesSameAlias() {
    String sql = compiler.compile("Post", compareFields("views", Operator.GE, "author"), "Post", new SqlParams());
    assertEquals("(\"Post\".\"views\" >= \"Post\".\"author\")", sql);
  }

  @Test
  void objectValueIsReducedToItsRelatedKey() {
    SqlParams p = new SqlParams();
    String sql = compiler.compile("Post", eq("author", Map.of("id", 3, "email", "a@b.c")), "Post", p);

    assertEquals("(\"Post\".\"author\" = :b1)", sql);
    assertEquals(3, p.asMap().get("b1").value());
  }

  @Test
  void nullComparisonsUseIsNull() {
    SqlParams p = new SqlParams();
    assertEquals("(\"Post\".\"author\" IS NULL)", compiler.compile("Post", eq("author", null), "Post", p));
    assertEquals("(\"Post\".\"author\" IS NOT NULL)", compiler.compile("Post", ne("author", null), "Post", p));
    assertTrue(p.asMap().isEmpty());
  }

  @Test
  void conditionEntityOverridesCompiledEntity() {
    String sql = compiler.compile("Post", QueryFilters.eq("url", "x").withEntity("Image"), "Post_cover", new SqlParams());
    assertEquals("(\"Post_cover\".\"url\" = :b1)", sql);
  }

  @Test
  void allEqualBuildsConjunction() {
    SqlParams p = new SqlParams();
    String sql = compiler.compile("Post", allEqual(Map.of("status", "draft")), "Post", p);
    assertEquals("(\"Post\".\"status\" = :b1)", sql);
    assertEquals("draft", p.asMap().get("b1").value());
  }
}
