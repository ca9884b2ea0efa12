package io.intellixity.relata.persistence.jdbc.dml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.jdbc.JdbcGateway;
import io.intellixity.relata.persistence.jdbc.JdbcReader;
import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.compile.ConditionCompiler;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.relation.Keys;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.exec.DependentSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Entity writes: insert, update, delete and increase, with their relation and list side effects.
 *
 * <p>Everything runs in the caller's transaction. Side effects that do not depend on each other run as
 * {@link DependentSteps}; a failing step fails the write.</p>
 */
public final class JdbcWritePipeline {
  private static final Logger log = LoggerFactory.getLogger(JdbcWritePipeline.class);

  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final JdbcGateway gateway;
  private final JdbcReader reader;
  private final ConditionCompiler conditions;
  private final DependentSteps steps;
  private final ObjectMapper json;
  private final RelationWriter relations;

  public JdbcWritePipeline(SchemaRegistry schemas, JdbcDialect dialect, JdbcGateway gateway, JdbcReader reader,
                           ConditionCompiler conditions, DependentSteps steps, ObjectMapper json) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.conditions = Objects.requireNonNull(conditions, "conditions");
    this.steps = Objects.requireNonNull(steps, "steps");
    this.json = Objects.requireNonNull(json, "json");
    this.relations = new RelationWriter(this, schemas, dialect, gateway, conditions, steps);
  }

  public RelationWriter relations() { return relations; }

  // --- insert ---

  public Map<String, Object> insertOne(String entity, Map<String, Object> value, Transaction tx) {
    Object id = insertRow(entity, value, tx);
    return reader.findById(entity, id, tx);
  }

  /** Inserts the row, then its relations and lists; returns the primary key. */
  Object insertRow(String entity, Map<String, Object> value, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String pk = s.primaryKey();
    ValueAnalysis.Analysed a = ValueAnalysis.analyse(s, value, json);

    Map<String, Object> columns = new LinkedHashMap<>(a.columns());
    Map<FieldDef, Object> deferred = new LinkedHashMap<>();
    for (var e : a.relations().entrySet()) {
      FieldDef f = e.getKey();
      switch (f.relation().kind()) {
        case ONE_TO_ONE, ONE_TO_MANY -> {
          Object rid = relations.existingId(f, e.getValue());
          if (rid != null) columns.put(f.name(), rid);
          else deferred.put(f, e.getValue());
        }
        case MANY_TO_MANY -> deferred.put(f, e.getValue());
        case REVERSE -> log.debug("relata.write ignoring reverse relation {}.{} on insert", entity, f.name());
      }
    }

    SqlParams p = new SqlParams();
    List<String> names = new ArrayList<>(columns.keySet());
    List<String> tuple = new ArrayList<>();
    for (String c : names) tuple.add(p.add(columns.get(c), s.field(c).type()));
    String sql = dialect.insertSql(entity, names, names.isEmpty() ? List.of() : List.of("(" + String.join(", ", tuple) + ")"), pk);
    List<Map<String, Object>> keys = gateway.execute(p.statement(sql, dialect.insertReturningExecKind()), tx);

    Object id = columns.get(pk) != null ? columns.get(pk) : (keys.isEmpty() ? null : Keys.first(keys.get(0)));
    if (id == null) throw new IllegalStateException("INSERT into " + entity + " returned no generated key");

    List<Runnable> dependent = new ArrayList<>();
    for (var e : deferred.entrySet()) dependent.add(() -> relations.add(entity, id, e.getKey(), e.getValue(), tx));
    for (var e : a.lists().entrySet()) dependent.add(() -> relations.insertList(entity, id, e.getKey(), e.getValue(), tx));
    steps.awaitAll(dependent);
    return id;
  }

  /**
   * Multi-row INSERT over plain and foreign-key columns, one statement per batch the dialect accepts;
   * returns {@code {pk: id}} per row.
   */
  public List<Map<String, Object>> insertMany(String entity, List<Map<String, Object>> values, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String pk = s.primaryKey();

    List<Map<String, Object>> rows = new ArrayList<>(values.size());
    for (Map<String, Object> v : values) {
      if (v == null) throw DatabaseException.invalidInput("insertAll(" + entity + ") got a null value");
      ValueAnalysis.Analysed a = ValueAnalysis.analyse(s, v, json);
      if (!a.lists().isEmpty()) {
        throw DatabaseException.invalidInput("insertAll(" + entity + ") does not write list fields " + names(a.lists().keySet()));
      }
      Map<String, Object> row = new LinkedHashMap<>(a.columns());
      for (var e : a.relations().entrySet()) {
        FieldDef f = e.getKey();
        Object rid = f.relation().kind().hasForeignKey() ? relations.existingId(f, e.getValue()) : null;
        if (rid == null) {
          throw DatabaseException.invalidInput("insertAll(" + entity + ") needs an existing id for relation '" + f.name() + "'");
        }
        row.put(f.name(), rid);
      }
      rows.add(row);
    }

    List<String> columns = new ArrayList<>();
    for (FieldDef f : s.fields().values()) {
      if (rows.stream().anyMatch(r -> r.containsKey(f.name()))) columns.add(f.name());
    }
    if (columns.isEmpty()) throw DatabaseException.invalidInput("insertAll(" + entity + ") needs at least one column");

    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (List<Map<String, Object>> batch : Lists.partition(rows, dialect.insertBatchSize(columns.size()))) {
      SqlParams p = new SqlParams();
      List<String> tuples = new ArrayList<>(batch.size());
      for (Map<String, Object> row : batch) {
        List<String> cells = new ArrayList<>(columns.size());
        for (String c : columns) cells.add(row.containsKey(c) ? p.add(row.get(c), s.field(c).type()) : "DEFAULT");
        tuples.add("(" + String.join(", ", cells) + ")");
      }
      List<Map<String, Object>> keys = gateway.execute(
          p.statement(dialect.insertSql(entity, columns, tuples, pk), dialect.insertReturningExecKind()), tx);
      for (Map<String, Object> k : keys) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(pk, Keys.first(k));
        out.add(m);
      }
    }
    return out;
  }

  // --- update ---

  public Map<String, Object> updateOne(String entity, Map<String, Object> value, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String pk = s.primaryKey();
    Object id = value.get(pk);
    ValueAnalysis.Analysed a = ValueAnalysis.analyse(s, value, json);

    Map<String, Object> columns = new LinkedHashMap<>(a.columns());
    columns.remove(pk);
    List<Runnable> dependent = new ArrayList<>();
    for (var e : a.relations().entrySet()) {
      FieldDef f = e.getKey();
      Object v = e.getValue();
      switch (f.relation().kind()) {
        case ONE_TO_ONE, ONE_TO_MANY -> {
          Object rid = relations.existingId(f, v);
          if (rid != null) columns.put(f.name(), rid);
          else dependent.add(() -> relations.addOneToMany(entity, id, f, v, tx));
        }
        case MANY_TO_MANY -> dependent.add(() -> relations.replaceManyToMany(entity, id, f, ValueAnalysis.toList(v), tx));
        case REVERSE -> log.debug("relata.write ignoring reverse relation {}.{} on update", entity, f.name());
      }
    }
    for (var e : a.lists().entrySet()) dependent.add(() -> relations.replaceList(entity, id, e.getKey(), e.getValue(), tx));
    steps.awaitAll(dependent);

    if (!columns.isEmpty()) {
      SqlParams p = new SqlParams();
      String sql = "UPDATE " + dialect.quoteIdent(entity) + " SET " + assignments(s, columns, p)
          + " WHERE " + dialect.quoteIdent(pk) + " = " + p.add(id, idType(s));
      gateway.execute(p.update(sql), tx);
    }
    return reader.findById(entity, id, tx);
  }

  public List<Map<String, Object>> updateMatching(String entity, Map<String, Object> value, QueryElement condition, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String pk = s.primaryKey();
    List<Object> ids = selectIds(entity, condition, tx);
    if (ids.isEmpty()) return List.of();

    ValueAnalysis.Analysed a = ValueAnalysis.analyse(s, value, json);
    Map<String, Object> columns = new LinkedHashMap<>(a.columns());
    columns.remove(pk);
    List<Runnable> dependent = new ArrayList<>();
    for (var e : a.relations().entrySet()) {
      FieldDef f = e.getKey();
      switch (f.relation().kind()) {
        case ONE_TO_ONE, ONE_TO_MANY -> {
          Object rid = relations.existingId(f, e.getValue());
          if (rid == null) {
            throw DatabaseException.invalidInput("updateByCriteria(" + entity + ") needs an existing id for relation '" + f.name() + "'");
          }
          columns.put(f.name(), rid);
        }
        case MANY_TO_MANY -> {
          List<Object> related = ValueAnalysis.toList(e.getValue());
          for (Object id : ids) dependent.add(() -> relations.replaceManyToMany(entity, id, f, related, tx));
        }
        case REVERSE -> log.debug("relata.write ignoring reverse relation {}.{} on update", entity, f.name());
      }
    }
    for (var e : a.lists().entrySet()) {
      for (Object id : ids) dependent.add(() -> relations.replaceList(entity, id, e.getKey(), e.getValue(), tx));
    }
    steps.awaitAll(dependent);

    if (!columns.isEmpty()) {
      for (List<Object> batch : Lists.partition(ids, dialect.inListBatchSize(columns.size()))) {
        SqlParams p = new SqlParams();
        String sql = "UPDATE " + dialect.quoteIdent(entity) + " SET " + assignments(s, columns, p)
            + " WHERE " + dialect.quoteIdent(pk) + " IN " + p.inList(batch, idType(s));
        gateway.execute(p.update(sql), tx);
      }
    }
    return reader.findByIds(entity, ids, tx);
  }

  public Map<String, Object> increase(String entity, Object id, String field, Number delta, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    SqlParams p = new SqlParams();
    String col = dialect.quoteIdent(field);
    String sql = "UPDATE " + dialect.quoteIdent(entity) + " SET " + col + " = " + col + " + " + p.add(delta, s.field(field).type())
        + " WHERE " + dialect.quoteIdent(s.primaryKey()) + " = " + p.add(id, idType(s));
    gateway.execute(p.update(sql), tx);
    return reader.findById(entity, id, tx);
  }

  // --- delete ---

  public List<Object> deleteOne(String entity, Object id, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    SqlParams p = new SqlParams();
    return deleteWhere(entity, dialect.qualify(entity, s.primaryKey()) + " = " + p.add(id, idType(s)), p, tx);
  }

  public List<Object> deleteMatching(String entity, QueryElement condition, Transaction tx) {
    SqlParams p = new SqlParams();
    return deleteWhere(entity, requireCondition(entity, condition, p), p, tx);
  }

  /** Cascading delete of the given rows; used for weak related rows. */
  List<Object> deleteByIds(String entity, Collection<Object> ids, Transaction tx) {
    if (ids.isEmpty()) return List.of();
    EntitySchema s = schemas.getSchema(entity);
    List<Object> deleted = new ArrayList<>(ids.size());
    for (List<Object> batch : Lists.partition(new ArrayList<>(ids), dialect.inListBatchSize(0))) {
      SqlParams p = new SqlParams();
      deleted.addAll(deleteWhere(entity, dialect.qualify(entity, s.primaryKey()) + " IN " + p.inList(batch, idType(s)), p, tx));
    }
    return deleted;
  }

  /**
   * Selects the matching ids (and weak foreign keys, which are gone after the delete), deletes the rows,
   * then cascades to junction rows, weak related rows and list rows.
   */
  private List<Object> deleteWhere(String entity, String where, SqlParams p, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String pk = s.primaryKey();
    List<FieldDef> weakFks = new ArrayList<>();
    for (FieldDef f : s.fields().values()) {
      if (f.isRelation() && f.relation().kind().hasForeignKey() && f.relation().weak()) weakFks.add(f);
    }

    List<String> select = new ArrayList<>();
    select.add(dialect.qualify(entity, pk));
    for (FieldDef f : weakFks) select.add(dialect.qualify(entity, f.name()));
    List<Map<String, Object>> rows = gateway.execute(p.query(
        "SELECT " + String.join(", ", select) + " FROM " + dialect.quoteIdent(entity) + " WHERE " + where), tx);

    List<Object> ids = new ArrayList<>();
    for (Map<String, Object> r : rows) {
      if (r.get(pk) != null) ids.add(r.get(pk));
    }
    if (ids.isEmpty()) return List.of();

    for (List<Object> batch : Lists.partition(ids, dialect.inListBatchSize(0))) {
      SqlParams dp = new SqlParams();
      gateway.execute(dp.update("DELETE FROM " + dialect.quoteIdent(entity)
          + " WHERE " + dialect.quoteIdent(pk) + " IN " + dp.inList(batch, idType(s))), tx);
    }

    List<Runnable> cascade = new ArrayList<>();
    for (FieldDef f : s.fields().values()) {
      if (f.isList()) {
        cascade.add(() -> relations.deleteLists(entity, f, ids, tx));
      } else if (f.isRelation()) {
        switch (f.relation().kind()) {
          case MANY_TO_MANY -> cascade.add(() -> relations.clearManyToMany(entity, f, ids, tx));
          case ONE_TO_ONE, ONE_TO_MANY -> {
            if (!f.relation().weak()) break;
            List<Object> related = distinct(rows, f.name());
            if (!related.isEmpty()) cascade.add(() -> deleteByIds(f.relation().targetEntity(), related, tx));
          }
          case REVERSE -> {
            // owned by the other side
          }
        }
      }
    }
    if (log.isDebugEnabled()) log.debug("relata.cascade entity={} deleted={} steps={}", entity, ids.size(), cascade.size());
    steps.awaitAll(cascade);
    return ids;
  }

  // --- helpers ---

  private List<Object> selectIds(String entity, QueryElement condition, Transaction tx) {
    String pk = schemas.primaryKeyField(entity);
    SqlParams p = new SqlParams();
    String where = requireCondition(entity, condition, p);
    List<Map<String, Object>> rows = gateway.execute(p.query("SELECT " + dialect.qualify(entity, pk)
        + " FROM " + dialect.quoteIdent(entity) + " WHERE " + where), tx);
    List<Object> ids = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) ids.add(Keys.first(r));
    return ids;
  }

  /** A criteria write must be narrowed by at least one declared column. */
  private String requireCondition(String entity, QueryElement condition, SqlParams p) {
    String where = conditions.compile(entity, condition, entity, p);
    if (where.isBlank()) {
      throw DatabaseException.invalidInput("Condition on " + entity + " references no declared column: " + condition);
    }
    return where;
  }

  private String assignments(EntitySchema s, Map<String, Object> columns, SqlParams p) {
    List<String> out = new ArrayList<>(columns.size());
    for (var e : columns.entrySet()) {
      out.add(dialect.quoteIdent(e.getKey()) + " = " + p.add(e.getValue(), s.field(e.getKey()).type()));
    }
    return String.join(", ", out);
  }

  static FieldType idType(EntitySchema s) {
    FieldDef f = s.field(s.primaryKey());
    return f == null || f.type().isStringLike() ? FieldType.INTEGER : f.type();
  }

  private static List<Object> distinct(List<Map<String, Object>> rows, String column) {
    Map<Object, Object> out = new LinkedHashMap<>();
    for (Map<String, Object> r : rows) {
      Object v = r.get(column);
      if (v != null) out.putIfAbsent(Keys.normalize(v), v);
    }
    return new ArrayList<>(out.values());
  }

  private static List<String> names(Collection<FieldDef> fields) {
    return fields.stream().map(FieldDef::name).toList();
  }
}
