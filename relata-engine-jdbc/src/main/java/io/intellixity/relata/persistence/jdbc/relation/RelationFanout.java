package io.intellixity.relata.persistence.jdbc.relation;

import com.google.common.collect.Lists;
import io.intellixity.relata.persistence.exec.Transaction;
import io.intellixity.relata.persistence.jdbc.JdbcGateway;
import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.mapping.ResultNormalizer;
import io.intellixity.relata.persistence.query.Query;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.query.RelationRequest;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.FieldType;
import io.intellixity.relata.persistence.schema.RelationKind;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.spi.exec.DependentSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Attaches many-to-many, reverse and list fields to rows fetched by the main query.
 *
 * <p>One secondary query per requested relation or list field, keyed by the owner ids of the page and split
 * into batches that fit the dialect's bind limit.
 * The queries run as {@link DependentSteps}; merging happens on the calling thread.
 * Every row receives every requested field, as {@code []} when nothing matches.</p>
 */
public final class RelationFanout {
  private static final Logger log = LoggerFactory.getLogger(RelationFanout.class);

  static final String OWNER_KEY = "relata_owner_key";
  static final String RELATED_KEY = "relata_related_key";

  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final JdbcGateway gateway;
  private final ResultNormalizer normalizer;
  private final DependentSteps steps;

  public RelationFanout(SchemaRegistry schemas, JdbcDialect dialect, JdbcGateway gateway,
                        ResultNormalizer normalizer, DependentSteps steps) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.steps = Objects.requireNonNull(steps, "steps");
  }

  /** True when {@code q} needs owner ids in its rows to attach secondary data. */
  public static boolean needsPrimaryKey(Query q, EntitySchema s) {
    return !fannedOutRelations(q, s).isEmpty() || !listFields(q, s).isEmpty();
  }

  static List<RelationRequest> fannedOutRelations(Query q, EntitySchema s) {
    List<RelationRequest> out = new ArrayList<>();
    for (RelationRequest r : q.relations()) {
      FieldDef f = s.field(r.name());
      if (f != null && f.isRelation() && !f.relation().kind().hasForeignKey()) out.add(r);
    }
    return out;
  }

  /** Every list field without an explicit selection, else the selected ones. */
  static List<FieldDef> listFields(Query q, EntitySchema s) {
    List<FieldDef> out = new ArrayList<>();
    List<String> selected = q.columnNames();
    for (FieldDef f : s.fields().values()) {
      if (f.isList() && (q.selections().isEmpty() || selected.contains(f.name()))) out.add(f);
    }
    return out;
  }

  public List<Map<String, Object>> attach(Query q, List<Map<String, Object>> rows, Transaction tx) {
    if (rows.isEmpty()) return rows;
    EntitySchema s = schemas.getSchema(q.entity());
    List<RelationRequest> relations = fannedOutRelations(q, s);
    List<FieldDef> lists = listFields(q, s);
    if (relations.isEmpty() && lists.isEmpty()) return rows;

    String pk = s.primaryKey();
    for (Map<String, Object> row : rows) {
      for (RelationRequest r : relations) row.put(r.name(), new ArrayList<>());
      for (FieldDef f : lists) row.put(f.name(), new ArrayList<>());
    }
    List<Object> ids = ownerIds(rows, pk);
    if (ids.isEmpty()) return rows;
    FieldType idType = idType(s);

    if (log.isDebugEnabled()) {
      log.debug("relata.fanout entity={} relations={} lists={} owners={}",
          s.name(), relations.size(), lists.size(), ids.size());
    }

    List<List<Object>> batches = Lists.partition(ids, dialect.inListBatchSize(0));
    List<Supplier<List<Map<String, Object>>>> queries = new ArrayList<>();
    for (RelationRequest r : relations) {
      FieldDef f = s.field(r.name());
      String related = f.relation().targetEntity();
      for (List<Object> batch : batches) {
        SqlStatement stmt = relationStatement(s, f, r, batch, idType);
        queries.add(() -> normalizer.normalize(related, gateway.execute(stmt, tx)));
      }
    }
    for (FieldDef f : lists) {
      for (List<Object> batch : batches) {
        SqlStatement stmt = listStatement(s.name(), f, batch, idType);
        queries.add(() -> gateway.execute(stmt, tx));
      }
    }
    List<List<Map<String, Object>>> results = steps.runAll(queries);

    // owners never span batches, so per-owner order survives concatenation
    Iterator<List<Map<String, Object>>> it = results.iterator();
    for (RelationRequest r : relations) {
      String relatedPk = schemas.primaryKeyField(s.field(r.name()).relation().targetEntity());
      mergeRelation(rows, pk, r.name(), relatedPk, concat(it, batches.size()));
    }
    for (FieldDef f : lists) {
      mergeList(rows, pk, f.name(), concat(it, batches.size()));
    }
    return rows;
  }

  private SqlStatement relationStatement(EntitySchema owner, FieldDef f, RelationRequest r, List<Object> ids, FieldType idType) {
    String related = f.relation().targetEntity();
    EntitySchema rs = schemas.getSchema(related);
    String relatedPk = rs.primaryKey();
    SqlParams p = new SqlParams();
    String fields = relatedFields(rs, r.fields());

    String sql = switch (f.relation().kind()) {
      case MANY_TO_MANY -> {
        var jc = RelationTables.junctionColumns(owner.name(), related);
        yield junctionSelect(fields, related, relatedPk, RelationTables.junction(owner.name(), f.name()),
            jc.owner(), jc.related(), p.inList(ids, idType));
      }
      case REVERSE -> {
        FieldDef counterpart = counterpart(rs, owner.name(), f);
        if (counterpart.relation().kind() == RelationKind.MANY_TO_MANY) {
          // junction declared by the related side: its owner column points back at the related row
          var jc = RelationTables.junctionColumns(related, owner.name());
          yield junctionSelect(fields, related, relatedPk, RelationTables.junction(related, counterpart.name()),
              jc.related(), jc.owner(), p.inList(ids, idType));
        }
        yield "SELECT " + fields
            + ", " + dialect.qualify("m", counterpart.name()) + " AS " + dialect.quoteIdent(OWNER_KEY)
            + ", " + dialect.qualify("m", relatedPk) + " AS " + dialect.quoteIdent(RELATED_KEY)
            + " FROM " + dialect.quoteIdent(related) + " AS " + dialect.quoteIdent("m")
            + " WHERE " + dialect.qualify("m", counterpart.name()) + " IN " + p.inList(ids, idType);
      }
      case ONE_TO_ONE, ONE_TO_MANY -> throw new IllegalArgumentException(
          "Relation " + owner.name() + "." + f.name() + " is embedded, not fanned out");
    };
    return p.query(sql);
  }

  private String junctionSelect(String fields, String related, String relatedPk, String junction,
                                String ownerCol, String relatedCol, String inList) {
    return "SELECT " + fields
        + ", " + dialect.qualify("r", ownerCol) + " AS " + dialect.quoteIdent(OWNER_KEY)
        + ", " + dialect.qualify("r", relatedCol) + " AS " + dialect.quoteIdent(RELATED_KEY)
        + " FROM " + dialect.quoteIdent(related) + " AS " + dialect.quoteIdent("m")
        + " LEFT JOIN " + dialect.quoteIdent(junction) + " AS " + dialect.quoteIdent("r")
        + " ON (" + dialect.qualify("m", relatedPk) + " = " + dialect.qualify("r", relatedCol) + ")"
        + " WHERE " + dialect.qualify("r", ownerCol) + " IN " + inList;
  }

  private SqlStatement listStatement(String entity, FieldDef f, List<Object> ids, FieldType idType) {
    SqlParams p = new SqlParams();
    String sql = "SELECT " + dialect.quoteIdent(RelationTables.LIST_FK) + ", " + dialect.quoteIdent(RelationTables.LIST_VALUE)
        + " FROM " + dialect.quoteIdent(RelationTables.list(entity, f.name()))
        + " WHERE " + dialect.quoteIdent(RelationTables.LIST_FK) + " IN " + p.inList(ids, idType)
        + " ORDER BY " + dialect.quoteIdent(RelationTables.ID);
    return p.query(sql);
  }

  /** The related entity's relation pointing back at {@code owner}. */
  private static FieldDef counterpart(EntitySchema related, String owner, FieldDef reverse) {
    for (FieldDef f : related.fields().values()) {
      if (f.isRelation() && f.relation().targetEntity().equals(owner) && f.relation().kind() != RelationKind.REVERSE) {
        return f;
      }
    }
    throw new QueryValidationException("Reverse relation '" + owner + "." + reverse.name() + "' has no counterpart field in model '"
        + related.name() + "'");
  }

  private String relatedFields(EntitySchema rs, List<String> wanted) {
    List<String> out = new ArrayList<>();
    for (FieldDef f : rs.fields().values()) {
      if (f.hasColumn() && (wanted.isEmpty() || wanted.contains(f.name()))) out.add(dialect.qualify("m", f.name()));
    }
    if (out.isEmpty()) out.add(dialect.qualify("m", rs.primaryKey()));
    return String.join(", ", out);
  }

  private static void mergeRelation(List<Map<String, Object>> rows, String pk, String field, String relatedPk,
                                    List<Map<String, Object>> related) {
    Map<Object, List<Map<String, Object>>> byOwner = new HashMap<>();
    for (Map<String, Object> r : related) {
      Map<String, Object> item = new LinkedHashMap<>(r);
      Object owner = item.remove(OWNER_KEY);
      Object relatedId = item.remove(RELATED_KEY);
      if (owner == null || relatedId == null) continue;
      item.put(relatedPk, relatedId);
      byOwner.computeIfAbsent(Keys.normalize(owner), k -> new ArrayList<>()).add(item);
    }
    for (Map<String, Object> row : rows) {
      List<Map<String, Object>> items = byOwner.getOrDefault(Keys.normalize(row.get(pk)), List.of());
      List<Object> target = listAt(row, field);
      for (Map<String, Object> item : items) target.add(new LinkedHashMap<>(item));
    }
  }

  private static void mergeList(List<Map<String, Object>> rows, String pk, String field, List<Map<String, Object>> values) {
    Map<Object, List<Object>> byOwner = new HashMap<>();
    for (Map<String, Object> v : values) {
      byOwner.computeIfAbsent(Keys.normalize(v.get(RelationTables.LIST_FK)), k -> new ArrayList<>())
          .add(v.get(RelationTables.LIST_VALUE));
    }
    for (Map<String, Object> row : rows) {
      listAt(row, field).addAll(byOwner.getOrDefault(Keys.normalize(row.get(pk)), List.of()));
    }
  }

  private static List<Map<String, Object>> concat(Iterator<List<Map<String, Object>>> results, int n) {
    if (n == 1) return results.next();
    List<Map<String, Object>> out = new ArrayList<>();
    for (int i = 0; i < n; i++) out.addAll(results.next());
    return out;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> listAt(Map<String, Object> row, String field) {
    return (List<Object>) row.get(field);
  }

  private static List<Object> ownerIds(List<Map<String, Object>> rows, String pk) {
    Map<Object, Object> ids = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      Object id = row.get(pk);
      if (id != null) ids.putIfAbsent(Keys.normalize(id), id);
    }
    return new ArrayList<>(ids.values());
  }

  private static FieldType idType(EntitySchema s) {
    FieldDef f = s.field(s.primaryKey());
    return f == null || f.type().isStringLike() ? FieldType.INTEGER : f.type();
  }
}
