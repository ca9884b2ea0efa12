package io.intellixity.relata.persistence.exec;

import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.QueryOptions;

import java.util.List;
import java.util.Map;

/**
 * CRUD surface over schema-described entities.
 *
 * <p>Every operation accepts a nullable {@link Transaction}. Writes given {@code null} run in a transaction
 * of their own, committed on success and rolled back on failure. Failures surface as {@link DatabaseException}.</p>
 */
public interface DataEngine {
  Transaction begin();

  QueryResult find(Query query, Transaction tx);

  QueryResult findById(String entity, Object id, QueryOptions options, Transaction tx);

  /** AND of equality conditions over the non-null values. */
  QueryResult findByValues(String entity, Map<String, Object> values, QueryOptions options, Transaction tx);

  QueryResult count(Query query, Transaction tx);

  QueryResult countByValues(String entity, Map<String, Object> values, Transaction tx);

  /** Inserts one row, then its relations and list fields. */
  UpsertResult insert(String entity, Map<String, Object> value, Transaction tx);

  /** Multi-row insert of plain and foreign-key columns; returns the generated keys. */
  UpsertResult insertAll(String entity, List<Map<String, Object>> values, Transaction tx);

  /** Updates the row identified by the value's primary key. */
  UpsertResult update(String entity, Map<String, Object> value, Transaction tx);

  UpsertResult updateByCriteria(String entity, Map<String, Object> value, QueryElement condition, Transaction tx);

  DeleteResult remove(String entity, Object id, Transaction tx);

  DeleteResult removeByCriteria(String entity, QueryElement condition, Transaction tx);

  /** Atomic {@code field = field + delta}. */
  UpsertResult increase(String entity, Object id, String field, Number delta, Transaction tx);

  /** Links {@code value} (an id, an object with an id, or a weak object to insert; a list for many-to-many). */
  UpsertResult addRelation(String entity, Object id, String relationField, Object value, Transaction tx);

  /** Unlinks related rows; {@code condition} narrows many-to-many removals and may be null. */
  UpsertResult removeRelation(String entity, Object id, String relationField, QueryElement condition, Transaction tx);

  /** Drops and recreates every table, including translation, junction and list tables. */
  void initializeSchema();
}
