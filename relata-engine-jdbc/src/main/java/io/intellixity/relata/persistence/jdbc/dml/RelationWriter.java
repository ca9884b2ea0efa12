package io.intellixity.relata.persistence.jdbc.dml;

import com.google.common.collect.Lists;
import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.jdbc.JdbcGateway;
import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.compile.ConditionCompiler;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.relation.Keys;
import io.intellixity.relata.persistence.jdbc.relation.RelationTables;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.exec.DependentSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Relation and list primitives: foreign-key assignment, junction rows, list rows.
 *
 * <p>Weak related objects are inserted when attached without an id and deleted when detached.</p>
 */
public final class RelationWriter {
  private static final Logger log = LoggerFactory.getLogger(RelationWriter.class);

  private final JdbcWritePipeline writes;
  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final JdbcGateway gateway;
  private final ConditionCompiler conditions;
  private final DependentSteps steps;

  RelationWriter(JdbcWritePipeline writes, SchemaRegistry schemas, JdbcDialect dialect, JdbcGateway gateway,
                 ConditionCompiler conditions, DependentSteps steps) {
    this.writes = writes;
    this.schemas = schemas;
    this.dialect = dialect;
    this.gateway = gateway;
    this.conditions = conditions;
    this.steps = steps;
  }

  public void add(String entity, Object id, FieldDef f, Object value, Transaction tx) {
    switch (f.relation().kind()) {
      case ONE_TO_ONE, ONE_TO_MANY -> addOneToMany(entity, id, f, value, tx);
      case MANY_TO_MANY -> addManyToMany(entity, id, f, ValueAnalysis.toList(value), tx);
      case REVERSE -> throw DatabaseException.invalidInput("Reverse relation " + entity + "." + f.name() + " is read-only");
    }
  }

  public void remove(String entity, Object id, FieldDef f, QueryElement condition, Transaction tx) {
    switch (f.relation().kind()) {
      case ONE_TO_ONE, ONE_TO_MANY -> removeOneToMany(entity, id, f, tx);
      case MANY_TO_MANY -> removeManyToMany(entity, id, f, condition, tx);
      case REVERSE -> throw DatabaseException.invalidInput("Reverse relation " + entity + "." + f.name() + " is read-only");
    }
  }

  // --- one-to-one / one-to-many ---

  public void addOneToMany(String entity, Object id, FieldDef f, Object value, Transaction tx) {
    Object relatedId = resolveId(f, value, tx);
    EntitySchema s = schemas.getSchema(entity);
    SqlParams p = new SqlParams();
    gateway.execute(p.update("UPDATE " + dialect.quoteIdent(entity)
        + " SET " + dialect.quoteIdent(f.name()) + " = " + p.add(relatedId, FieldType.RELATION)
        + " WHERE " + dialect.quoteIdent(s.primaryKey()) + " = " + p.add(id, JdbcWritePipeline.idType(s))), tx);
  }

  /** Deletes the related row when weak, then clears the foreign key. */
  public void removeOneToMany(String entity, Object id, FieldDef f, Transaction tx) {
    EntitySchema s = schemas.getSchema(entity);
    String byId = dialect.quoteIdent(s.primaryKey()) + " = ";

    if (f.relation().weak()) {
      SqlParams sp = new SqlParams();
      List<Map<String, Object>> rows = gateway.execute(sp.query("SELECT " + dialect.quoteIdent(f.name())
          + " FROM " + dialect.quoteIdent(entity) + " WHERE " + byId + sp.add(id, JdbcWritePipeline.idType(s))), tx);
      Object relatedId = rows.isEmpty() ? null : Keys.first(rows.get(0));
      if (relatedId != null) writes.deleteByIds(f.relation().targetEntity(), List.of(relatedId), tx);
    }

    SqlParams p = new SqlParams();
    gateway.execute(p.update("UPDATE " + dialect.quoteIdent(entity) + " SET " + dialect.quoteIdent(f.name()) + " = NULL"
        + " WHERE " + byId + p.add(id, JdbcWritePipeline.idType(s))), tx);
  }

  // --- many-to-many ---

  /** Inserts weak objects lacking an id, then writes the junction rows in as few INSERTs as the dialect allows. */
  public void addManyToMany(String entity, Object id, FieldDef f, List<Object> values, Transaction tx) {
    List<Supplier<Object>> resolve = new ArrayList<>();
    for (Object v : values) {
      if (v != null) resolve.add(() -> resolveId(f, v, tx));
    }
    List<Object> relatedIds = steps.runAll(resolve);
    if (relatedIds.isEmpty()) return;

    var jc = RelationTables.junctionColumns(entity, f.relation().targetEntity());
    for (List<Object> batch : Lists.partition(relatedIds, dialect.insertBatchSize(2))) {
      SqlParams p = new SqlParams();
      List<String> tuples = new ArrayList<>(batch.size());
      for (Object rid : batch) {
        tuples.add("(" + p.add(id, FieldType.INTEGER) + ", " + p.add(rid, FieldType.INTEGER) + ")");
      }
      gateway.execute(p.update(dialect.insertSql(RelationTables.junction(entity, f.name()),
          List.of(jc.owner(), jc.related()), tuples, null)), tx);
    }
  }

  /** Wholesale replacement of the owner's junction rows. */
  public void replaceManyToMany(String entity, Object id, FieldDef f, List<Object> values, Transaction tx) {
    var jc = RelationTables.junctionColumns(entity, f.relation().targetEntity());
    SqlParams p = new SqlParams();
    gateway.execute(p.update("DELETE FROM " + dialect.quoteIdent(RelationTables.junction(entity, f.name()))
        + " WHERE " + dialect.quoteIdent(jc.owner()) + " = " + p.add(id, FieldType.INTEGER)), tx);
    addManyToMany(entity, id, f, values, tx);
  }

  /**
   * Deletes the owner's junction rows, narrowed to related rows matching {@code condition} when given.
   * A condition matching nothing deletes nothing; one that names no declared column is rejected.
   * Weak related rows are deleted with their junction rows.
   */
  public void removeManyToMany(String entity, Object id, FieldDef f, QueryElement condition, Transaction tx) {
    if (condition == null) {
      deleteJunctionRows(entity, id, f, null, tx);
      return;
    }
    String related = f.relation().targetEntity();
    SqlParams cp = new SqlParams();
    String where = conditions.compile(related, condition, related, cp);
    if (where.isBlank()) {
      throw DatabaseException.invalidInput("Condition on " + related + " references no declared column: " + condition);
    }
    List<Object> matching = firstColumn(gateway.execute(cp.query("SELECT " + dialect.qualify(related, schemas.primaryKeyField(related))
        + " FROM " + dialect.quoteIdent(related) + " WHERE " + where), tx));
    if (matching.isEmpty()) {
      deleteJunctionRows(entity, id, f, List.of(), tx);
      return;
    }
    for (List<Object> batch : Lists.partition(matching, dialect.inListBatchSize(1))) {
      deleteJunctionRows(entity, id, f, batch, tx);
    }
  }

  /** Junction rows of one owner, all of them when {@code relatedIds} is null. */
  private void deleteJunctionRows(String entity, Object id, FieldDef f, List<Object> relatedIds, Transaction tx) {
    String related = f.relation().targetEntity();
    var jc = RelationTables.junctionColumns(entity, related);
    String junction = dialect.quoteIdent(RelationTables.junction(entity, f.name()));
    SqlParams p = new SqlParams();
    String where = dialect.quoteIdent(jc.owner()) + " = " + p.add(id, FieldType.INTEGER);
    if (relatedIds != null) {
      where += " AND " + (relatedIds.isEmpty()
          ? dialect.falsePredicate()
          : dialect.quoteIdent(jc.related()) + " IN " + p.inList(relatedIds, FieldType.INTEGER));
    }

    List<Object> orphans = f.relation().weak()
        ? firstColumn(gateway.execute(p.query("SELECT " + dialect.quoteIdent(jc.related()) + " FROM " + junction + " WHERE " + where), tx))
        : List.of();
    gateway.execute(p.update("DELETE FROM " + junction + " WHERE " + where), tx);
    if (!orphans.isEmpty()) writes.deleteByIds(related, orphans, tx);
  }

  /** Cascade for deleted owners: their junction rows, and weak related rows. */
  void clearManyToMany(String entity, FieldDef f, List<Object> ownerIds, Transaction tx) {
    String related = f.relation().targetEntity();
    var jc = RelationTables.junctionColumns(entity, related);
    String junction = dialect.quoteIdent(RelationTables.junction(entity, f.name()));
    List<Object> orphans = new ArrayList<>();
    for (List<Object> batch : Lists.partition(ownerIds, dialect.inListBatchSize(0))) {
      SqlParams p = new SqlParams();
      String where = dialect.quoteIdent(jc.owner()) + " IN " + p.inList(batch, FieldType.INTEGER);
      if (f.relation().weak()) {
        orphans.addAll(firstColumn(gateway.execute(p.query("SELECT " + dialect.quoteIdent(jc.related()) + " FROM " + junction + " WHERE " + where), tx)));
      }
      gateway.execute(p.update("DELETE FROM " + junction + " WHERE " + where), tx);
    }
    if (!orphans.isEmpty()) {
      if (log.isDebugEnabled()) log.debug("relata.cascade entity={} weak={} orphans={}", entity, f.name(), orphans.size());
      writes.deleteByIds(related, orphans, tx);
    }
  }

  // --- lists ---

  public void insertList(String entity, Object id, FieldDef f, List<Object> values, Transaction tx) {
    List<Object> present = new ArrayList<>();
    for (Object v : values) {
      if (v != null) present.add(v);
    }
    if (present.isEmpty()) return;
    for (List<Object> batch : Lists.partition(present, dialect.insertBatchSize(2))) {
      SqlParams p = new SqlParams();
      List<String> tuples = new ArrayList<>(batch.size());
      for (Object v : batch) {
        tuples.add("(" + p.add(id, FieldType.INTEGER) + ", " + p.add(v, f.listElementType()) + ")");
      }
      gateway.execute(p.update(dialect.insertSql(RelationTables.list(entity, f.name()),
          List.of(RelationTables.LIST_FK, RelationTables.LIST_VALUE), tuples, null)), tx);
    }
  }

  public void replaceList(String entity, Object id, FieldDef f, List<Object> values, Transaction tx) {
    SqlParams p = new SqlParams();
    gateway.execute(p.update("DELETE FROM " + dialect.quoteIdent(RelationTables.list(entity, f.name()))
        + " WHERE " + dialect.quoteIdent(RelationTables.LIST_FK) + " = " + p.add(id, FieldType.INTEGER)), tx);
    insertList(entity, id, f, values, tx);
  }

  void deleteLists(String entity, FieldDef f, List<Object> ownerIds, Transaction tx) {
    for (List<Object> batch : Lists.partition(ownerIds, dialect.inListBatchSize(0))) {
      SqlParams p = new SqlParams();
      gateway.execute(p.update("DELETE FROM " + dialect.quoteIdent(RelationTables.list(entity, f.name()))
          + " WHERE " + dialect.quoteIdent(RelationTables.LIST_FK) + " IN " + p.inList(batch, FieldType.INTEGER)), tx);
    }
  }

  // --- ids ---

  /** Id referenced by {@code value}: the value itself, or the related primary key of an object; null for an object without one. */
  Object existingId(FieldDef f, Object value) {
    String relatedPk = schemas.primaryKeyField(f.relation().targetEntity());
    Object id = value instanceof Map<?, ?> m ? m.get(relatedPk) : value;
    if (id == null) return null;
    if (!(id instanceof Number || id instanceof String)) {
      throw DatabaseException.invalidInput("Relation '" + f.name() + "' expects an id or an object, got " + id.getClass().getSimpleName());
    }
    if (id instanceof Number n && n.doubleValue() < 0) {
      throw DatabaseException.invalidInput("Relation '" + f.name() + "' got a negative id: " + id);
    }
    return id;
  }

  /** Existing id, or the id of a weak object inserted now. */
  private Object resolveId(FieldDef f, Object value, Transaction tx) {
    Object id = existingId(f, value);
    if (id != null) return id;
    String related = f.relation().targetEntity();
    if (!(value instanceof Map<?, ?> m)) {
      throw DatabaseException.invalidInput("Relation '" + f.name() + "' needs an id or an object");
    }
    if (!f.relation().weak()) {
      throw DatabaseException.invalidInput("Relation '" + f.name() + "' is not weak; related " + related
          + " objects must carry '" + schemas.primaryKeyField(related) + "'");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> obj = (Map<String, Object>) m;
    return writes.insertRow(related, obj, tx);
  }

  private static List<Object> firstColumn(List<Map<String, Object>> rows) {
    List<Object> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Object v = Keys.first(r);
      if (v != null) out.add(v);
    }
    return out;
  }
}
