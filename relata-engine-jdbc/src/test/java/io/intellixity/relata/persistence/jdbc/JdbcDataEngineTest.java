package io.intellixity.relata.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.exec.*;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryOptions;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.intellixity.relata.persistence.jdbc.RecordingGateway.row;
import static io.intellixity.relata.persistence.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcDataEngineTest {
  private final RecordingGateway gw = new RecordingGateway();
  private final JdbcDataEngine engine = new JdbcDataEngine(gw, new AnsiTestDialect(), BlogSchemas.registry(),
      Runnable::run, new ObjectMapper(), null);

  private static Map<String, Object> value(Object... keyValues) {
    return row(keyValues);
  }

  @Test
  void insertWritesJunctionRowsAndFindAttachesTags() {
    gw.on("INSERT INTO \"Post\" ", row("id", 7))
        .on("FROM \"Post\" WHERE", row("id", 7, "title", "Hello"))
        .on("LEFT JOIN \"PostHasTags\"",
            row("id", 1, "label", "a", "relata_owner_key", 7L, "relata_related_key", 1),
            row("id", 2, "label", "b", "relata_owner_key", 7L, "relata_related_key", 2));

    UpsertResult inserted = engine.insert("Post", value("title", "Hello", "tags", List.of(1, 2)), null);

    assertEquals("Hello", inserted.first().get("title"));
    SqlStatement insert = gw.matching("INSERT INTO \"Post\" ").get(0);
    assertEquals("INSERT INTO \"Post\" (\"title\") VALUES (?) RETURNING \"id\"", insert.sql());
    List<SqlStatement> junction = gw.matching("INSERT INTO \"PostHasTags\"");
    assertEquals(1, junction.size());
    assertEquals("INSERT INTO \"PostHasTags\" (\"post\", \"tag\") VALUES (?, ?), (?, ?)", junction.get(0).sql());
    assertEquals(List.of(7, 1, 7, 2), junction.get(0).values());
    assertEquals("commit", gw.transactions().get(0).outcome());

    QueryResult found = engine.find(Query.from("Post").where(eq("id", 7)).relation("tags"), null);

    Map<String, Object> post = found.first();
    assertEquals(List.of(Map.of("id", 1, "label", "a"), Map.of("id", 2, "label", "b")), post.get("tags"));
    assertEquals(List.of(), post.get("keywords"));
  }

  @Test
  void updateReplacesTagsWholesale() {
    gw.on("FROM \"Post\" WHERE", row("id", 5, "title", "t"));

    engine.update("Post", value("id", 5, "tags", List.of(3)), null);

    List<String> sqls = gw.sqls();
    int delete = sqls.indexOf("DELETE FROM \"PostHasTags\" WHERE \"post\" = ?");
    int insert = sqls.indexOf("INSERT INTO \"PostHasTags\" (\"post\", \"tag\") VALUES (?, ?)");
    assertTrue(delete >= 0 && insert > delete, sqls.toString());
    assertEquals(List.of(5, 3), gw.executed().get(insert).values());
    assertTrue(gw.matching("UPDATE \"Post\"").isEmpty(), "no plain columns to update");
  }

  @Test
  void updateSetsColumnsByPrimaryKey() {
    engine.update("Post", value("id", 5, "title", "new", "meta", Map.of("pinned", true)), null);

    SqlStatement update = gw.matching("UPDATE \"Post\"").get(0);
    assertEquals("UPDATE \"Post\" SET \"title\" = ?, \"meta\" = ? WHERE \"id\" = ?", update.sql());
    assertEquals(List.of("new", "{\"pinned\":true}", 5), update.values());
  }

  @Test
  void deleteRemovesJunctionAndListRowsButKeepsTags() {
    gw.on("SELECT \"Post\".\"id\", \"Post\".\"cover\" FROM \"Post\"", row("id", 5, "cover", null));

    DeleteResult deleted = engine.remove("Post", 5, null);

    assertEquals(List.of(5), deleted.ids());
    assertEquals(List.of(
        "SELECT \"Post\".\"id\", \"Post\".\"cover\" FROM \"Post\" WHERE \"Post\".\"id\" = ?",
        "DELETE FROM \"Post\" WHERE \"id\" IN (?)",
        "DELETE FROM \"PostHasTags\" WHERE \"post\" IN (?)",
        "DELETE FROM \"PostKeywordsList\" WHERE \"fk\" IN (?)"), gw.sqls());
    assertTrue(gw.sqls().stream().noneMatch(s -> s.contains("\"Tag\"")));
  }

  @Test
  void deleteCascadesToWeakRelatedRow() {
    gw.on("FROM \"Post\" WHERE", row("id", 5, "cover", 9))
        .on("FROM \"Image\" WHERE", row("id", 9));

    engine.remove("Post", 5, null);

    assertTrue(gw.sqls().contains("DELETE FROM \"Image\" WHERE \"id\" IN (?)"), gw.sqls().toString());
  }

  @Test
  void nothingMatchedDeletesNothing() {
    DeleteResult deleted = engine.removeByCriteria("Post", eq("status", "gone"), null);

    assertTrue(deleted.ids().isEmpty());
    assertEquals(1, gw.executed().size());
  }

  @Test
  void criteriaWritesNeedADeclaredColumn() {
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> engine.updateByCriteria("Post", value("status", "x"), eq("ghost", 1), null));
    assertEquals(ErrorKind.INVALID_INPUT, ex.kind());
    assertTrue(gw.executed().isEmpty());
    assertEquals("rollback", gw.transactions().get(0).outcome());
  }

  @Test
  void updateByCriteriaUpdatesMatchedIds() {
    gw.on("SELECT \"Post\".\"id\" FROM \"Post\" WHERE", row("id", 1), row("id", 2));

    engine.updateByCriteria("Post", value("status", "archived"), eq("status", "old"), null);

    SqlStatement update = gw.matching("UPDATE \"Post\"").get(0);
    assertEquals("UPDATE \"Post\" SET \"status\" = ? WHERE \"id\" IN (?, ?)", update.sql());
    assertEquals(List.of("archived", 1, 2), update.values());
  }

  @Test
  void insertAllWithNoValuesIssuesNoSql() {
    UpsertResult r = engine.insertAll("Post", List.of(), null);

    assertTrue(r.items().isEmpty());
    assertTrue(gw.executed().isEmpty());
    assertTrue(gw.transactions().isEmpty());
  }

  @Test
  void insertAllUsesOneStatementWithDefaults() {
    gw.on("INSERT INTO \"Post\"", row("id", 1), row("id", 2));

    UpsertResult r = engine.insertAll("Post", List.of(value("title", "a"), value("title", "b", "views", 3)), null);

    assertEquals("INSERT INTO \"Post\" (\"title\", \"views\") VALUES (?, DEFAULT), (?, ?) RETURNING \"id\"", gw.sqls().get(0));
    assertEquals(List.of(Map.of("id", 1), Map.of("id", 2)), r.items());
  }

  @Test
  void insertAllRejectsListFields() {
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> engine.insertAll("Post", List.of(value("title", "a", "keywords", List.of("x"))), null));
    assertEquals(ErrorKind.INVALID_INPUT, ex.kind());
    assertEquals("rollback", gw.transactions().get(0).outcome());
  }

  @Test
  void removeManyToManyWithNoMatchUsesFalsePredicate() {
    engine.removeRelation("Post", 5, "tags", eq("label", "none"), null);

    SqlStatement delete = gw.matching("DELETE FROM \"PostHasTags\"").get(0);
    assertEquals("DELETE FROM \"PostHasTags\" WHERE \"post\" = ? AND 1 = 0", delete.sql());
  }

  @Test
  void removeManyToManyRejectsConditionWithoutDeclaredColumn() {
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> engine.removeRelation("Post", 5, "tags", eq("ghost", "x"), null));

    assertEquals(ErrorKind.INVALID_INPUT, ex.kind());
    assertTrue(gw.matching("DELETE FROM \"PostHasTags\"").isEmpty(), gw.sqls().toString());
    assertEquals("rollback", gw.transactions().get(0).outcome());
  }

  @Test
  void removeManyToManyWithoutConditionClearsOwner() {
    engine.removeRelation("Post", 5, "tags", null, null);

    SqlStatement delete = gw.matching("DELETE FROM \"PostHasTags\"").get(0);
    assertEquals("DELETE FROM \"PostHasTags\" WHERE \"post\" = ?", delete.sql());
    assertEquals(List.of(5), delete.values());
  }

  @Test
  void removeManyToManyNarrowsToMatchingTags() {
    gw.on("SELECT \"Tag\".\"id\" FROM \"Tag\"", row("id", 3), row("id", 4));

    engine.removeRelation("Post", 5, "tags", eq("label", "old"), null);

    SqlStatement delete = gw.matching("DELETE FROM \"PostHasTags\"").get(0);
    assertEquals("DELETE FROM \"PostHasTags\" WHERE \"post\" = ? AND \"tag\" IN (?, ?)", delete.sql());
    assertEquals(List.of(5, 3, 4), delete.values());
  }

  @Test
  void weakObjectIsInsertedThenLinked() {
    gw.on("INSERT INTO \"Post\" ", row("id", 7))
        .on("INSERT INTO \"Image\"", row("id", 11));

    engine.insert("Post", value("title", "x", "cover", Map.of("url", "c.png")), null);

    assertTrue(gw.sqls().contains("INSERT INTO \"Image\" (\"url\") VALUES (?) RETURNING \"id\""), gw.sqls().toString());
    SqlStatement link = gw.matching("UPDATE \"Post\" SET \"cover\"").get(0);
    assertEquals(List.of(11, 7), link.values());
  }

  @Test
  void strongObjectWithoutIdIsRejected() {
    gw.on("INSERT INTO \"Post\" ", row("id", 7));

    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> engine.insert("Post", value("title", "x", "author", Map.of("email", "a@b.org")), null));
    assertEquals(ErrorKind.INVALID_INPUT, ex.kind());
    assertEquals("rollback", gw.transactions().get(0).outcome());
  }

  @Test
  void existingRelatedIdIsWrittenAsColumn() {
    gw.on("INSERT INTO \"Post\" ", row("id", 7));

    engine.insert("Post", value("title", "x", "author", Map.of("id", 2)), null);

    SqlStatement insert = gw.matching("INSERT INTO \"Post\" ").get(0);
    assertEquals("INSERT INTO \"Post\" (\"title\", \"author\") VALUES (?, ?) RETURNING \"id\"", insert.sql());
    assertEquals(List.of("x", 2), insert.values());
  }

  @Test
  void listValuesRoundTrip() {
    gw.on("INSERT INTO \"Post\" ", row("id", 7))
        .on("FROM \"PostKeywordsList\"", row("fk", 7L, "value", "a"), row("fk", 7L, "value", "b"))
        .on("FROM \"Post\" WHERE", row("id", 7, "title", "x"));

    UpsertResult r = engine.insert("Post", value("title", "x", "keywords", Arrays.asList("a", null, "b")), null);

    SqlStatement list = gw.matching("INSERT INTO \"PostKeywordsList\"").get(0);
    assertEquals("INSERT INTO \"PostKeywordsList\" (\"fk\", \"value\") VALUES (?, ?), (?, ?)", list.sql());
    assertEquals(List.of(7, "a", 7, "b"), list.values());
    assertEquals(List.of("a", "b"), r.first().get("keywords"));
  }

  @Test
  void reverseRelationIsReadThroughCounterpartColumn() {
    gw.on("FROM \"User\" WHERE", row("id", 2, "email", "a@b.org"))
        .on("FROM \"Post\" AS \"m\"", row("id", 7, "title", "x", "relata_owner_key", 2, "relata_related_key", 7));

    QueryResult r = engine.findById("User", 2, QueryOptions.none().relation("posts"), null);

    assertEquals(List.of(Map.of("id", 7, "title", "x")), r.first().get("posts"));
    assertTrue(gw.sqls().get(1).endsWith("WHERE \"m\".\"author\" IN (?)"), gw.sqls().get(1));
  }

  @Test
  void reverseRelationIsReadOnly() {
    DatabaseException ex = assertThrows(DatabaseException.class, () -> engine.addRelation("User", 2, "posts", 7, null));
    assertEquals(ErrorKind.INVALID_INPUT, ex.kind());
  }

  @Test
  void unknownRelationIsConfigurationError() {
    DatabaseException ex = assertThrows(DatabaseException.class,
        () -> engine.find(Query.from("Post").relation("comments"), null));
    assertEquals(ErrorKind.RELATION_CONFIG, ex.kind());
  }

  @Test
  void rejectedStatementRollsBackAndIsTaggedWithOperation() {
    gw.failOn("INSERT INTO \"Post\"");

    DatabaseException ex = assertThrows(DatabaseException.class, () -> engine.insert("Post", value("title", "x"), null));

    assertEquals(ErrorKind.INSERT, ex.kind());
    assertTrue(ex.getCause() instanceof SqlExecutionException);
    assertEquals("rollback", gw.transactions().get(0).outcome());
  }

  @Test
  void callerTransactionIsNotFinished() {
    Transaction tx = engine.begin();

    engine.increase("Post", 5, "views", 2, tx);

    assertTrue(tx.isActive());
    assertEquals("UPDATE \"Post\" SET \"views\" = \"views\" + ? WHERE \"id\" = ?", gw.sqls().get(0));
    assertEquals(List.of(2, 5), gw.executed().get(0).values());
  }

  @Test
  void countReadsTotal() {
    gw.on("COUNT(*)", row("total", 3L));
    assertEquals(3, engine.count(Query.from("Post").where(eq("status", "open")), null).total());
  }
}
