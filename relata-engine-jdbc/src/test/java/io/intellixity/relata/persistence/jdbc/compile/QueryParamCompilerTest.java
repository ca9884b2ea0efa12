package io.intellixity.relata.persistence.jdbc.compile;

import io.intellixity.relata.persistence.jdbc.AnsiTestDialect;
import io.intellixity.relata.persistence.jdbc.BlogSchemas;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.query.Join;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relata.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryParamCompilerTest {
  private static final String POST_COLUMNS = "\"Post\".\"id\", \"Post\".\"title\", \"Post\".\"status\", \"Post\".\"views\", "
      + "\"Post\".\"author\", \"Post\".\"cover\", \"Post\".\"meta\"";

  private final QueryParamCompiler compiler = new QueryParamCompiler(BlogSchemas.registry(), new AnsiTestDialect());

  @Test
  void limitWithoutSortOrdersByPrimaryKey() {
    SqlStatement s = compiler.select(Query.from("Post").withLimit(10).withPage(3));

    assertEquals("SELECT " + POST_COLUMNS + " FROM \"Post\" ORDER BY \"Post\".\"id\" ASC LIMIT 10 OFFSET 20", s.sql());
    assertTrue(s.binds().isEmpty());
  }

  @Test
  void explicitSortSuppressesDefaultOrder() {
    String sql = compiler.select(Query.from("Post").withLimit(5).orderBy(SortField.desc("views"))).sql();

    assertTrue(sql.endsWith(" ORDER BY \"Post\".\"views\" DESC LIMIT 5 OFFSET 0"), sql);
    assertFalse(sql.contains("\"Post\".\"id\" ASC"));
  }

  @Test
  void unpagedQueryHasNoOrderBy() {
    String sql = compiler.select(Query.from("Tag")).sql();
    assertEquals("SELECT \"Tag\".\"id\", \"Tag\".\"label\" FROM \"Tag\"", sql);
  }

  @Test
  void filterBecomesBoundWhereClause() {
    SqlStatement s = compiler.select(Query.from("Post").select("title").where(and(eq("status", "open"), or())));

    assertEquals("SELECT \"Post\".\"title\" FROM \"Post\" WHERE (\"Post\".\"status\" = ?)", s.sql());
    assertEquals(List.of("open"), s.values());
  }

  @Test
  void fannedOutFieldsAddPrimaryKeyAndStayOutOfSql() {
    String sql = compiler.select(Query.from("Post").select("title", "tags", "keywords").relation("tags")).sql();

    assertEquals("SELECT \"Post\".\"title\", \"Post\".\"id\" FROM \"Post\"", sql);
  }

  @Test
  void foreignKeyRelationIsEmbeddedAsJsonSubSelect() {
    String sql = compiler.select(Query.from("Post").relation("author", "email")).sql();

    String q = QueryParamCompiler.QUOTE_MARKER;
    String sub = "(SELECT CONCAT('{', '" + q + "email" + q + ":" + q + "', \"Post_author\".\"email\", '" + q + "', '}')"
        + " FROM \"User\" AS \"Post_author\" WHERE \"Post_author\".\"id\" = \"Post\".\"author\" LIMIT 1) AS \"author\"";
    assertTrue(sql.contains(sub), sql);
    assertFalse(sql.contains("\"Post\".\"author\","), "embedded relation is not also selected as a column");
  }

  @Test
  void joinAliasesAreDeterministicAndDeduplicated() {
    Query q = Query.from("Post")
        .select("title")
        .relation("author")
        .join(Join.left("author", Query.from("User").select("email").where(like("email", "%@x.org"))));

    String sql = compiler.select(q).sql();

    assertTrue(sql.contains("\"Post_author_2\".\"email\" AS \"Post_author_2.email\""), sql);
    assertTrue(sql.contains("LEFT JOIN \"User\" AS \"Post_author_2\" ON (\"Post\".\"author\" = \"Post_author_2\".\"id\")"), sql);
    assertTrue(sql.contains("WHERE (\"Post_author_2\".\"email\" LIKE ?)"), sql);
    assertEquals(sql, compiler.select(q).sql());
  }

  @Test
  void joinedSortAppliesOnlyWithoutDefaultOrder() {
    Query joined = Query.from("User").orderBy(SortField.asc("email"));
    String unpaged = compiler.select(Query.from("Post").select("title").join(Join.inner("author", joined))).sql();
    assertTrue(unpaged.endsWith("ORDER BY \"Post_author\".\"email\" ASC"), unpaged);

    String paged = compiler.select(Query.from("Post").select("title").join(Join.inner("author", joined)).withLimit(2)).sql();
    assertTrue(paged.endsWith("ORDER BY \"Post\".\"id\" ASC LIMIT 2 OFFSET 0"), paged);
  }

  @Test
  void subQuerySelectionIsLabelledByEntity() {
    Query sub = Query.from("Image").select("url").where(eq("id", 1));
    SqlStatement s = compiler.select(Query.from("Post").select("title").selectSubQuery(sub).where(eq("status", "open")));

    assertTrue(s.sql().contains("FROM \"Image\" AS \"image\" WHERE (\"image\".\"id\" = ?) LIMIT 1) AS \"image\""), s.sql());
    assertEquals(List.of(1, "open"), s.values());
  }

  @Test
  void unknownRelationIsRejected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> compiler.select(Query.from("Post").relation("comments")));
    assertEquals("Relation field 'comments' not found in model 'Post'", ex.getMessage());
  }

  @Test
  void joinMustFollowForeignKeyToItsEntity() {
    assertThrows(QueryValidationException.class,
        () -> compiler.select(Query.from("Post").join(Join.left("tags", Query.from("Tag")))));
    assertThrows(QueryValidationException.class,
        () -> compiler.select(Query.from("Post").join(Join.left("author", Query.from("Image")))));
  }

  @Test
  void countIgnoresOrderAndPaging() {
    SqlStatement s = compiler.count(Query.from("Post").where(eq("status", "open")).withLimit(10));

    assertEquals("SELECT COUNT(*) AS total FROM \"Post\" WHERE (\"Post\".\"status\" = ?)", s.sql());
    assertEquals(List.of("open"), s.values());
  }

  @Test
  void sameQueryCompilesToSameSql() {
    Query q = Query.from("Post").relation("cover").relation("author")
        .where(or(eq("status", "open"), gt("views", 3))).withLimit(4);
    assertEquals(compiler.select(q), compiler.select(q));
  }
}
