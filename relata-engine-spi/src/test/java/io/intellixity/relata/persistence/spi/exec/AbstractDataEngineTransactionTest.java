package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.exec.*;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.schema.*;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractDataEngineTransactionTest {

  private static final SchemaRegistry SCHEMAS = InMemorySchemaRegistry.of(
      EntitySchema.of("Post",
          FieldDef.builder("id", FieldType.INTEGER).primary().build(),
          FieldDef.builder("title", FieldType.STRING).build(),
          FieldDef.builder("views", FieldType.INTEGER).build(),
          FieldDef.builder("tags", FieldType.RELATION).relation(RelationDef.of("Tag", RelationKind.MANY_TO_MANY)).build()),
      EntitySchema.of("Tag",
          FieldDef.builder("id", FieldType.INTEGER).primary().build()));

  private static final Dialect DIALECT = new Dialect() {
    @Override public String id() { return "test"; }
    @Override public String quoteIdent(String ident) { return ident; }
  };

  private static final class RecordingTx implements Transaction {
    int commits;
    int rollbacks;

    @Override public void commit() { commits++; }
    @Override public void rollback() { rollbacks++; }
    @Override public boolean isActive() { return commits + rollbacks == 0; }
  }

  private static final class ScriptedEngine extends AbstractDataEngine {
    final List<RecordingTx> opened = new ArrayList<>();
    final AtomicInteger inserts = new AtomicInteger();
    RuntimeException failInsertWith;
    Transaction lastTx;

    ScriptedEngine() { super(DIALECT, SCHEMAS); }

    @Override protected Transaction openTransaction() {
      RecordingTx tx = new RecordingTx();
      opened.add(tx);
      return tx;
    }

    @Override protected List<Map<String, Object>> findRows(Query query, Transaction txOrNull) {
      lastTx = txOrNull;
      return List.of(Map.of("id", 1));
    }

    @Override protected long countRows(Query query, Transaction txOrNull) { return 42; }

    @Override protected Map<String, Object> insertOne(String entity, Map<String, Object> value, Transaction tx) {
      lastTx = tx;
      inserts.incrementAndGet();
      if (failInsertWith != null) throw failInsertWith;
      Map<String, Object> row = new LinkedHashMap<>(value);
      row.put("id", 7);
      return row;
    }

    @Override protected List<Map<String, Object>> insertMany(String entity, List<Map<String, Object>> values, Transaction tx) {
      inserts.addAndGet(values.size());
      return List.of();
    }

    @Override protected Map<String, Object> updateOne(String entity, Map<String, Object> value, Transaction tx) { return value; }
    @Override protected List<Map<String, Object>> updateMatching(String entity, Map<String, Object> value, QueryElement condition, Transaction tx) { return List.of(); }
    @Override protected List<Object> deleteOne(String entity, Object id, Transaction tx) { return List.of(id); }
    @Override protected List<Object> deleteMatching(String entity, QueryElement condition, Transaction tx) { return List.of(); }
    @Override protected Map<String, Object> increaseField(String entity, Object id, String field, Number delta, Transaction tx) { return Map.of("id", id); }
    @Override protected Map<String, Object> attachRelation(String entity, Object id, String field, Object value, Transaction tx) { return Map.of("id", id); }
    @Override protected Map<String, Object> detachRelation(String entity, Object id, String field, QueryElement condition, Transaction tx) { return Map.of("id", id); }
    @Override protected void createSchema() {}
  }

  @Test
  void ownedTransactionIsCommittedOnSuccess() {
    ScriptedEngine e = new ScriptedEngine();
    UpsertResult r = e.insert("Post", Map.of("title", "Hello"), null);

    assertEquals(7, r.first().get("id"));
    assertEquals(1, e.opened.size());
    assertEquals(1, e.opened.get(0).commits);
    assertEquals(0, e.opened.get(0).rollbacks);
    assertSame(e.opened.get(0), e.lastTx);
  }

  @Test
  void ownedTransactionIsRolledBackAndFailureWrapped() {
    ScriptedEngine e = new ScriptedEngine();
    e.failInsertWith = new IllegalStateException("duplicate key");

    DatabaseException ex = assertThrows(DatabaseException.class, () -> e.insert("Post", Map.of("title", "x"), null));

    assertEquals(ErrorKind.INSERT, ex.kind());
    assertTrue(ex.getMessage().contains("duplicate key"));
    assertEquals(0, e.opened.get(0).commits);
    assertEquals(1, e.opened.get(0).rollbacks);
  }

  @Test
  void passedTransactionIsNeverFinishedByCallee() {
    ScriptedEngine e = new ScriptedEngine();
    RecordingTx callerTx = new RecordingTx();
    e.failInsertWith = new IllegalStateException("boom");

    assertThrows(DatabaseException.class, () -> e.insert("Post", Map.of("title", "x"), callerTx));

    assertTrue(e.opened.isEmpty());
    assertEquals(0, callerTx.commits);
    assertEquals(0, callerTx.rollbacks);
    assertSame(callerTx, e.lastTx);
  }

  @Test
  void classifiedFailuresKeepTheirKind() {
    ScriptedEngine e = new ScriptedEngine();
    e.failInsertWith = new DatabaseException(ErrorKind.CONNECTION, "pool exhausted");

    DatabaseException ex = assertThrows(DatabaseException.class, () -> e.insert("Post", Map.of(), null));
    assertEquals(ErrorKind.CONNECTION, ex.kind());
  }

  @Test
  void insertAllWithNoRowsDoesNothing() {
    ScriptedEngine e = new ScriptedEngine();
    UpsertResult r = e.insertAll("Post", List.of(), null);

    assertTrue(r.items().isEmpty());
    assertTrue(e.opened.isEmpty());
    assertEquals(0, e.inserts.get());
  }

  @Test
  void readsDoNotOpenTransactions() {
    ScriptedEngine e = new ScriptedEngine();
    QueryResult found = e.findById("Post", 1, null, null);
    QueryResult counted = e.count(Query.from("Post"), null);

    assertEquals(1, found.total());
    assertEquals(42, counted.total());
    assertTrue(e.opened.isEmpty());
    assertNull(e.lastTx);
  }

  @Test
  void rejectsMalformedInput() {
    ScriptedEngine e = new ScriptedEngine();

    assertEquals(ErrorKind.INVALID_INPUT,
        assertThrows(DatabaseException.class, () -> e.remove("Post", Map.of("id", 1), null)).kind());
    assertEquals(ErrorKind.INVALID_INPUT,
        assertThrows(DatabaseException.class, () -> e.update("Post", Map.of("title", "no id"), null)).kind());
    assertEquals(ErrorKind.INVALID_INPUT,
        assertThrows(DatabaseException.class, () -> e.removeByCriteria("Post", null, null)).kind());
    assertEquals(ErrorKind.INVALID_INPUT,
        assertThrows(DatabaseException.class, () -> e.increase("Post", 1, "title", 1, null)).kind());
    assertEquals(ErrorKind.INVALID_INPUT,
        assertThrows(DatabaseException.class, () -> e.find(Query.from("Ghost"), null)).kind());
    assertTrue(e.opened.isEmpty());
  }

  @Test
  void unknownRelationIsAConfigurationError() {
    ScriptedEngine e = new ScriptedEngine();
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> e.addRelation("Post", 1, "title", 3, null));
    assertEquals(ErrorKind.RELATION_CONFIG, ex.kind());

    UpsertResult ok = e.removeRelation("Post", 1, "tags", QueryFilters.eq("id", 3), null);
    assertEquals(1, ok.first().get("id"));
    assertEquals(1, e.opened.get(0).commits);
  }
}
