package io.intellixity.relata.persistence.jdbc;

import com.google.common.collect.Lists;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.jdbc.compile.CompiledQuery;
import io.intellixity.relata.persistence.jdbc.compile.QueryParamCompiler;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.mapping.ResultNormalizer;
import io.intellixity.relata.persistence.jdbc.relation.Keys;
import io.intellixity.relata.persistence.jdbc.relation.RelationFanout;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.SortField;
import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Query path: compile, execute, normalize, fan out. Writes use it to re-read what they stored. */
public final class JdbcReader {
  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final JdbcGateway gateway;
  private final QueryParamCompiler compiler;
  private final ResultNormalizer normalizer;
  private final RelationFanout fanout;

  public JdbcReader(SchemaRegistry schemas, JdbcDialect dialect, JdbcGateway gateway, QueryParamCompiler compiler,
                    ResultNormalizer normalizer, RelationFanout fanout) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.fanout = Objects.requireNonNull(fanout, "fanout");
  }

  public List<Map<String, Object>> find(Query q, Transaction tx) {
    List<Map<String, Object>> rows = normalizer.normalize(q.entity(), gateway.execute(compiler.select(q), tx));
    return fanout.attach(q, rows, tx);
  }

  public long count(Query q, Transaction tx) {
    List<Map<String, Object>> rows = gateway.execute(compiler.count(q), tx);
    if (rows.isEmpty()) return 0;
    Object v = rows.get(0).containsKey("total") ? rows.get(0).get("total") : Keys.first(rows.get(0));
    return v instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(v));
  }

  /** The stored row, or null when it does not exist. */
  public Map<String, Object> findById(String entity, Object id, Transaction tx) {
    return first(find(byId(entity, id), tx));
  }

  /** The stored row with {@code relation} resolved. */
  public Map<String, Object> findById(String entity, Object id, String relation, Transaction tx) {
    return first(find(byId(entity, id).relation(relation), tx));
  }

  /** Rows with the given ids, in primary-key order per batch of ids. */
  public List<Map<String, Object>> findByIds(String entity, Collection<Object> ids, Transaction tx) {
    if (ids.isEmpty()) return List.of();
    String pk = schemas.primaryKeyField(entity);
    Query q = Query.from(entity).orderBy(SortField.asc(pk));
    List<Object> idList = new ArrayList<>(ids);
    List<Map<String, Object>> rows = new ArrayList<>(idList.size());
    int batchSize = dialect.inListBatchSize(compiler.compile(q).params().size());
    for (List<Object> batch : Lists.partition(idList, batchSize)) {
      CompiledQuery base = compiler.compile(q);
      String in = dialect.qualify(entity, pk) + " IN " + base.params().inList(batch, FieldType.INTEGER);
      CompiledQuery byIds = new CompiledQuery(base.from(), base.fields(), in, base.orderBy(), "", base.joins(), base.params());
      rows.addAll(normalizer.normalize(entity, gateway.execute(byIds.select(), tx)));
    }
    return fanout.attach(q, rows, tx);
  }

  private Query byId(String entity, Object id) {
    return Query.from(entity).where(QueryFilters.eq(schemas.primaryKeyField(entity), id)).withLimit(1);
  }

  private static Map<String, Object> first(List<Map<String, Object>> rows) {
    return rows.isEmpty() ? null : rows.get(0);
  }
}
