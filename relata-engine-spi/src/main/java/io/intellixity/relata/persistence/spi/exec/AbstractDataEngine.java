package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.exec.*;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.QueryOptions;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for persistence operations.
 *
 * Responsibilities:
 * <ul>
 *   <li>argument validation ({@link ErrorKind#INVALID_INPUT})</li>
 *   <li>transaction ownership: a write given no transaction begins one, commits it on success and rolls it
 *   back on failure; a passed-in transaction is only used</li>
 *   <li>wrapping backend failures into {@link DatabaseException} tagged with the operation's kind</li>
 * </ul>
 * Backends implement the protected hooks.
 */
public abstract class AbstractDataEngine implements DataEngine {
  private static final Logger log = LoggerFactory.getLogger(AbstractDataEngine.class);

  private final Dialect dialect;
  private final SchemaRegistry schemas;

  protected AbstractDataEngine(Dialect dialect, SchemaRegistry schemas) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  protected final Dialect dialect() { return dialect; }
  protected final SchemaRegistry schemas() { return schemas; }

  @Override
  public final Transaction begin() {
    return openTransaction();
  }

  // --- Reads ---

  @Override
  public final QueryResult find(Query query, Transaction tx) {
    Objects.requireNonNull(query, "query");
    requireEntity(query.entity());
    return read("find", () -> QueryResult.of(findRows(query, tx)));
  }

  @Override
  public final QueryResult findById(String entity, Object id, QueryOptions options, Transaction tx) {
    requireEntity(entity);
    requireId(entity, id);
    Query q = options(options).applyTo(Query.from(entity))
        .where(QueryFilters.eq(schemas.primaryKeyField(entity), id))
        .withLimit(1);
    return read("findById", () -> QueryResult.of(findRows(q, tx)));
  }

  @Override
  public final QueryResult findByValues(String entity, Map<String, Object> values, QueryOptions options, Transaction tx) {
    requireEntity(entity);
    if (values == null) throw DatabaseException.invalidInput("findByValues(" + entity + ") requires values");
    Query q = options(options).applyTo(Query.from(entity)).where(QueryFilters.allEqual(values));
    return read("findByValues", () -> QueryResult.of(findRows(q, tx)));
  }

  @Override
  public final QueryResult count(Query query, Transaction tx) {
    Objects.requireNonNull(query, "query");
    requireEntity(query.entity());
    return read("count", () -> QueryResult.count(countRows(query, tx)));
  }

  @Override
  public final QueryResult countByValues(String entity, Map<String, Object> values, Transaction tx) {
    requireEntity(entity);
    Query q = Query.from(entity).where(QueryFilters.allEqual(values == null ? Map.of() : values));
    return read("countByValues", () -> QueryResult.count(countRows(q, tx)));
  }

  // --- Writes ---

  @Override
  public final UpsertResult insert(String entity, Map<String, Object> value, Transaction tx) {
    requireEntity(entity);
    if (value == null) throw DatabaseException.invalidInput("insert(" + entity + ") requires a value");
    return inWriteTx(tx, ErrorKind.INSERT, "insert", t -> single(insertOne(entity, value, t)));
  }

  @Override
  public final UpsertResult insertAll(String entity, List<Map<String, Object>> values, Transaction tx) {
    requireEntity(entity);
    if (values == null || values.isEmpty()) return UpsertResult.empty();
    return inWriteTx(tx, ErrorKind.INSERT, "insertAll", t -> new UpsertResult(insertMany(entity, values, t)));
  }

  @Override
  public final UpsertResult update(String entity, Map<String, Object> value, Transaction tx) {
    requireEntity(entity);
    String pk = schemas.primaryKeyField(entity);
    if (value == null || value.get(pk) == null) {
      throw DatabaseException.invalidInput("update(" + entity + ") requires '" + pk + "' in the value");
    }
    return inWriteTx(tx, ErrorKind.UPDATE, "update", t -> single(updateOne(entity, value, t)));
  }

  @Override
  public final UpsertResult updateByCriteria(String entity, Map<String, Object> value, QueryElement condition, Transaction tx) {
    requireEntity(entity);
    if (value == null) throw DatabaseException.invalidInput("updateByCriteria(" + entity + ") requires a value");
    if (condition == null) throw DatabaseException.invalidInput("updateByCriteria(" + entity + ") requires a condition");
    return inWriteTx(tx, ErrorKind.UPDATE, "updateByCriteria",
        t -> new UpsertResult(updateMatching(entity, value, condition, t)));
  }

  @Override
  public final DeleteResult remove(String entity, Object id, Transaction tx) {
    requireEntity(entity);
    requireId(entity, id);
    return inWriteTx(tx, ErrorKind.DELETE, "remove", t -> new DeleteResult(deleteOne(entity, id, t)));
  }

  @Override
  public final DeleteResult removeByCriteria(String entity, QueryElement condition, Transaction tx) {
    requireEntity(entity);
    if (condition == null) throw DatabaseException.invalidInput("removeByCriteria(" + entity + ") requires a condition");
    return inWriteTx(tx, ErrorKind.DELETE, "removeByCriteria", t -> new DeleteResult(deleteMatching(entity, condition, t)));
  }

  @Override
  public final UpsertResult increase(String entity, Object id, String field, Number delta, Transaction tx) {
    requireEntity(entity);
    requireId(entity, id);
    FieldDef f = field == null ? null : schemas.getField(entity, field);
    if (f == null || !f.type().isNumeric() || f.primary()) {
      throw DatabaseException.invalidInput("increase(" + entity + "): '" + field + "' is not a numeric field");
    }
    if (delta == null) throw DatabaseException.invalidInput("increase(" + entity + "." + field + ") requires a delta");
    return inWriteTx(tx, ErrorKind.UPDATE, "increase", t -> single(increaseField(entity, id, field, delta, t)));
  }

  @Override
  public final UpsertResult addRelation(String entity, Object id, String relationField, Object value, Transaction tx) {
    requireEntity(entity);
    requireId(entity, id);
    requireRelation(entity, relationField);
    return inWriteTx(tx, ErrorKind.UPDATE, "addRelation",
        t -> single(attachRelation(entity, id, relationField, value, t)));
  }

  @Override
  public final UpsertResult removeRelation(String entity, Object id, String relationField, QueryElement condition, Transaction tx) {
    requireEntity(entity);
    requireId(entity, id);
    requireRelation(entity, relationField);
    return inWriteTx(tx, ErrorKind.UPDATE, "removeRelation",
        t -> single(detachRelation(entity, id, relationField, condition, t)));
  }

  @Override
  public final void initializeSchema() {
    read("initializeSchema", () -> {
      createSchema();
      return null;
    });
  }

  // --- Transaction + error plumbing ---

  /** Runs {@code work} in {@code tx}, or in a transaction owned by this call when {@code tx} is null. */
  protected final <T> T inWriteTx(Transaction tx, ErrorKind kind, String op, Function<Transaction, T> work) {
    if (tx != null) {
      try {
        return work.apply(tx);
      } catch (RuntimeException e) {
        throw wrap(kind, op, e);
      }
    }

    Transaction owned = openTransaction();
    try {
      T result = work.apply(owned);
      owned.commit();
      if (log.isDebugEnabled()) log.debug("relata.tx op={} dialect={} outcome=commit", op, dialect.id());
      return result;
    } catch (RuntimeException e) {
      rollbackAfter(owned, op, e);
      throw wrap(kind, op, e);
    }
  }

  private <T> T read(String op, Supplier<T> work) {
    try {
      return work.get();
    } catch (RuntimeException e) {
      throw wrap(ErrorKind.QUERY, op, e);
    }
  }

  private void rollbackAfter(Transaction owned, String op, RuntimeException cause) {
    if (!owned.isActive()) return;
    try {
      owned.rollback();
      if (log.isDebugEnabled()) log.debug("relata.tx op={} dialect={} outcome=rollback", op, dialect.id());
    } catch (RuntimeException re) {
      log.warn("relata.tx op={} dialect={} rollback failed: {}", op, dialect.id(), re.getMessage());
      cause.addSuppressed(re);
    }
  }

  private DatabaseException wrap(ErrorKind kind, String op, RuntimeException e) {
    // Already classified (connection, invalid input, relation config) keeps its kind.
    if (e instanceof DatabaseException de) return de;
    String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return new DatabaseException(kind, dialect.id() + " " + op + " failed: " + msg, e);
  }

  private void requireEntity(String entity) {
    if (entity == null || !schemas.entityNames().contains(entity)) {
      throw DatabaseException.invalidInput("Unknown entity: " + entity);
    }
  }

  private static void requireId(String entity, Object id) {
    boolean ok = id instanceof Number || (id instanceof String s && !s.isBlank());
    if (!ok) throw DatabaseException.invalidInput("Invalid id for " + entity + ": " + id);
  }

  private void requireRelation(String entity, String field) {
    FieldDef f = field == null ? null : schemas.getField(entity, field);
    if (f == null || !f.isRelation()) {
      throw new QueryValidationException("Relation field '" + field + "' not found in model '" + entity + "'");
    }
  }

  private static QueryOptions options(QueryOptions o) {
    return o == null ? QueryOptions.none() : o;
  }

  private static UpsertResult single(Map<String, Object> row) {
    return row == null ? UpsertResult.empty() : new UpsertResult(List.of(row));
  }

  // --- Backend-specific hooks ---

  protected abstract Transaction openTransaction();

  protected abstract List<Map<String, Object>> findRows(Query query, Transaction txOrNull);

  protected abstract long countRows(Query query, Transaction txOrNull);

  /** @return the inserted row as stored, or null if it could not be re-read */
  protected abstract Map<String, Object> insertOne(String entity, Map<String, Object> value, Transaction tx);

  protected abstract List<Map<String, Object>> insertMany(String entity, List<Map<String, Object>> values, Transaction tx);

  protected abstract Map<String, Object> updateOne(String entity, Map<String, Object> value, Transaction tx);

  protected abstract List<Map<String, Object>> updateMatching(String entity, Map<String, Object> value,
                                                              QueryElement condition, Transaction tx);

  protected abstract List<Object> deleteOne(String entity, Object id, Transaction tx);

  protected abstract List<Object> deleteMatching(String entity, QueryElement condition, Transaction tx);

  protected abstract Map<String, Object> increaseField(String entity, Object id, String field, Number delta, Transaction tx);

  protected abstract Map<String, Object> attachRelation(String entity, Object id, String field, Object value, Transaction tx);

  protected abstract Map<String, Object> detachRelation(String entity, Object id, String field,
                                                        QueryElement condition, Transaction tx);

  protected abstract void createSchema();
}
