package io.intellixity.relata.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.jdbc.compile.ConditionCompiler;
import io.intellixity.relata.persistence.jdbc.compile.QueryParamCompiler;
import io.intellixity.relata.persistence.jdbc.ddl.SchemaInitializer;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.dml.JdbcWritePipeline;
import io.intellixity.relata.persistence.jdbc.mapping.ResultNormalizer;
import io.intellixity.relata.persistence.jdbc.relation.RelationFanout;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.exec.AbstractDataEngine;
import io.intellixity.relata.persistence.spi.exec.DependentSteps;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/** {@link io.intellixity.relata.persistence.exec.DataEngine} over JDBC. */
public final class JdbcDataEngine extends AbstractDataEngine implements AutoCloseable {
  private final JdbcGateway gateway;
  private final JdbcReader reader;
  private final JdbcWritePipeline writes;
  private final SchemaInitializer ddl;
  private final AutoCloseable resource;

  public JdbcDataEngine(JdbcGateway gateway, JdbcDialect dialect, SchemaRegistry schemas) {
    this(gateway, dialect, schemas, ForkJoinPool.commonPool(), new ObjectMapper(), null);
  }

  /**
   * @param executor runs dependent steps; {@code Runnable::run} keeps everything on the calling thread
   * @param resource closed with the engine (typically the connection pool), may be null
   */
  public JdbcDataEngine(JdbcGateway gateway, JdbcDialect dialect, SchemaRegistry schemas,
                        Executor executor, ObjectMapper json, AutoCloseable resource) {
    super(dialect, schemas);
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.resource = resource;

    DependentSteps steps = new DependentSteps(executor);
    ConditionCompiler conditions = new ConditionCompiler(schemas, dialect);
    QueryParamCompiler compiler = new QueryParamCompiler(schemas, dialect, conditions);
    ResultNormalizer normalizer = new ResultNormalizer(schemas, json);
    RelationFanout fanout = new RelationFanout(schemas, dialect, gateway, normalizer, steps);
    this.reader = new JdbcReader(schemas, dialect, gateway, compiler, normalizer, fanout);
    this.writes = new JdbcWritePipeline(schemas, dialect, gateway, reader, conditions, steps, json);
    this.ddl = new SchemaInitializer(schemas, dialect, gateway);
  }

  @Override
  protected Transaction openTransaction() {
    return gateway.begin();
  }

  @Override
  protected List<Map<String, Object>> findRows(Query query, Transaction txOrNull) {
    return reader.find(query, txOrNull);
  }

  @Override
  protected long countRows(Query query, Transaction txOrNull) {
    return reader.count(query, txOrNull);
  }

  @Override
  protected Map<String, Object> insertOne(String entity, Map<String, Object> value, Transaction tx) {
    return writes.insertOne(entity, value, tx);
  }

  @Override
  protected List<Map<String, Object>> insertMany(String entity, List<Map<String, Object>> values, Transaction tx) {
    return writes.insertMany(entity, values, tx);
  }

  @Override
  protected Map<String, Object> updateOne(String entity, Map<String, Object> value, Transaction tx) {
    return writes.updateOne(entity, value, tx);
  }

  @Override
  protected List<Map<String, Object>> updateMatching(String entity, Map<String, Object> value,
                                                     QueryElement condition, Transaction tx) {
    return writes.updateMatching(entity, value, condition, tx);
  }

  @Override
  protected List<Object> deleteOne(String entity, Object id, Transaction tx) {
    return writes.deleteOne(entity, id, tx);
  }

  @Override
  protected List<Object> deleteMatching(String entity, QueryElement condition, Transaction tx) {
    return writes.deleteMatching(entity, condition, tx);
  }

  @Override
  protected Map<String, Object> increaseField(String entity, Object id, String field, Number delta, Transaction tx) {
    return writes.increase(entity, id, field, delta, tx);
  }

  @Override
  protected Map<String, Object> attachRelation(String entity, Object id, String field, Object value, Transaction tx) {
    FieldDef f = schemas().getField(entity, field);
    writes.relations().add(entity, id, f, value, tx);
    return reader.findById(entity, id, field, tx);
  }

  @Override
  protected Map<String, Object> detachRelation(String entity, Object id, String field, QueryElement condition, Transaction tx) {
    FieldDef f = schemas().getField(entity, field);
    writes.relations().remove(entity, id, f, condition, tx);
    return reader.findById(entity, id, field, tx);
  }

  @Override
  protected void createSchema() {
    ddl.initialize();
  }

  @Override
  public void close() {
    if (resource == null) return;
    try {
      resource.close();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close " + resource, e);
    }
  }
}
