package io.intellixity.relata.persistence.jdbc.compile;

import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.SqlStatement;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.relation.RelationFanout;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.EntitySchema;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.util.Names;

import java.util.*;

/**
 * Compiles a {@link Query} into SELECT and COUNT statements.
 *
 * <p>The root table is aliased by its entity name. One-to-x relations are embedded as JSON built with
 * {@code CONCAT} in a correlated single-row sub-select; many-to-many, reverse and list fields are left
 * to {@link RelationFanout}. Joined queries contribute their columns (labelled {@code "alias.col"}),
 * filter, sort and nested joins. A limit without a resolvable sort orders by the primary key so pages are stable.</p>
 */
public final class QueryParamCompiler {
  /** Stands in for '"' inside embedded JSON until the row is normalized. */
  public static final String QUOTE_MARKER = "<#quote#>";

  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final ConditionCompiler conditions;

  public QueryParamCompiler(SchemaRegistry schemas, JdbcDialect dialect) {
    this(schemas, dialect, new ConditionCompiler(schemas, dialect));
  }

  public QueryParamCompiler(SchemaRegistry schemas, JdbcDialect dialect, ConditionCompiler conditions) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.conditions = Objects.requireNonNull(conditions, "conditions");
  }

  public SqlStatement select(Query q) { return compile(q).select(); }

  public SqlStatement count(Query q) { return compile(q).count(); }

  public CompiledQuery compile(Query q) {
    Objects.requireNonNull(q, "query");
    Acc acc = new Acc();
    acc.aliases.reserve(q.entity());
    compileInto(q, q.entity(), true, acc);

    List<String> orderBy = new ArrayList<>(acc.rootOrder);
    if (orderBy.isEmpty() && q.limit() > 0) {
      orderBy.add(dialect.qualify(q.entity(), schemas.primaryKeyField(q.entity())) + " ASC");
    } else {
      orderBy.addAll(acc.joinedOrder);
    }

    OffsetPage page = q.offsetPage();
    String condition = switch (acc.conditions.size()) {
      case 0 -> "";
      case 1 -> acc.conditions.get(0);
      default -> "(" + String.join(" AND ", acc.conditions) + ")";
    };
    List<String> fields = acc.fields.isEmpty() ? List.of(dialect.quoteIdent(q.entity()) + ".*") : acc.fields;

    return new CompiledQuery(dialect.quoteIdent(q.entity()), fields, condition, orderBy,
        page == null ? "" : dialect.paginate(page), acc.joins, acc.params);
  }

  private void compileInto(Query q, String alias, boolean root, Acc acc) {
    EntitySchema s = schemas.getSchema(q.entity());

    Set<String> embedded = new HashSet<>();
    for (RelationRequest r : q.relations()) {
      FieldDef f = s.field(r.name());
      if (f == null || !f.isRelation()) {
        throw new QueryValidationException("Relation field '" + r.name() + "' not found in model '" + s.name() + "'");
      }
      if (f.relation().kind().hasForeignKey()) embedded.add(f.name());
    }

    project(q, s, alias, root, embedded, acc);

    for (RelationRequest r : q.relations()) {
      FieldDef f = s.field(r.name());
      switch (f.relation().kind()) {
        case ONE_TO_ONE, ONE_TO_MANY -> acc.fields.add(relationSubSelect(alias, f, r, acc) + " AS " + label(alias, f.name(), root));
        case MANY_TO_MANY, REVERSE -> {
          // fanned out after the main query
        }
      }
    }

    String cond = conditions.compile(q.entity(), q.filter(), alias, acc.params);
    if (!cond.isBlank()) acc.conditions.add(cond);

    List<String> order = root ? acc.rootOrder : acc.joinedOrder;
    for (SortField sf : q.sort()) {
      FieldDef f = s.field(sf.field());
      if (f == null || !f.hasColumn()) continue;
      order.add(dialect.qualify(alias, f.name()) + (sf.descending() ? " DESC" : " ASC"));
    }

    for (Join j : q.joins()) {
      FieldDef f = s.field(j.field());
      if (f == null || !f.isRelation() || !f.relation().kind().hasForeignKey()) {
        throw new QueryValidationException(
            "Join field '" + j.field() + "' is not a one-to-one or one-to-many relation of model '" + s.name() + "'");
      }
      String target = f.relation().targetEntity();
      if (!target.equals(j.query().entity())) {
        throw new QueryValidationException("Join on '" + s.name() + "." + j.field() + "' targets '" + target
            + "', got a query on '" + j.query().entity() + "'");
      }
      String joinAlias = acc.aliases.allocate(alias + "_" + j.field());
      acc.joins.add(j.kind().keyword() + " " + dialect.quoteIdent(target) + " AS " + dialect.quoteIdent(joinAlias)
          + " ON (" + dialect.qualify(alias, f.name()) + " = " + dialect.qualify(joinAlias, schemas.primaryKeyField(target)) + ")");
      compileInto(j.query(), joinAlias, false, acc);
    }
  }

  private void project(Query q, EntitySchema s, String alias, boolean root, Set<String> embedded, Acc acc) {
    Set<String> columns = new HashSet<>();
    if (q.selections().isEmpty()) {
      for (FieldDef f : s.fields().values()) {
        if (f.hasColumn() && !embedded.contains(f.name())) acc.fields.add(column(alias, f.name(), root));
      }
      return;
    }
    for (Selection sel : q.selections()) {
      if (sel instanceof Selection.Column c) {
        FieldDef f = s.field(c.field());
        if (f == null || !f.hasColumn() || embedded.contains(f.name()) || !columns.add(f.name())) continue;
        acc.fields.add(column(alias, f.name(), root));
      } else if (sel instanceof Selection.SubQuery sq) {
        acc.fields.add(subQuerySelect(sq.query(), alias, root, acc));
      }
    }
    String pk = s.primaryKey();
    if (root && RelationFanout.needsPrimaryKey(q, s) && !columns.contains(pk)) acc.fields.add(column(alias, pk, true));
  }

  private String column(String alias, String col, boolean root) {
    String expr = dialect.qualify(alias, col);
    return root ? expr : expr + " AS " + label(alias, col, false);
  }

  private String relationSubSelect(String alias, FieldDef f, RelationRequest r, Acc acc) {
    String target = f.relation().targetEntity();
    EntitySchema ts = schemas.getSchema(target);
    String sa = acc.aliases.allocate(alias + "_" + f.name());
    String where = dialect.qualify(sa, ts.primaryKey()) + " = " + dialect.qualify(alias, f.name());
    return dialect.singleRowSubSelect(jsonObject(ts, r.fields(), sa),
        dialect.quoteIdent(target) + " AS " + dialect.quoteIdent(sa), where);
  }

  private String subQuerySelect(Query sub, String alias, boolean root, Acc acc) {
    EntitySchema ss = schemas.getSchema(sub.entity());
    String name = Names.camel(sub.entity());
    String sa = acc.aliases.allocate(name);
    String where = conditions.compile(sub.entity(), sub.filter(), sa, acc.params);
    return dialect.singleRowSubSelect(jsonObject(ss, sub.columnNames(), sa),
        dialect.quoteIdent(sub.entity()) + " AS " + dialect.quoteIdent(sa), where) + " AS " + label(alias, name, root);
  }

  /** {@code CONCAT('{', '<q>name<q>:<q>', a.name, '<q>', ',', ..., '}')}. */
  private String jsonObject(EntitySchema s, List<String> wanted, String alias) {
    List<String> names = new ArrayList<>();
    for (FieldDef f : s.fields().values()) {
      if (f.hasColumn() && (wanted.isEmpty() || wanted.contains(f.name()))) names.add(f.name());
    }
    if (names.isEmpty()) names.add(s.primaryKey());

    List<String> parts = new ArrayList<>();
    parts.add("'{'");
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) parts.add("','");
      String n = names.get(i);
      parts.add("'" + QUOTE_MARKER + n + QUOTE_MARKER + ":" + QUOTE_MARKER + "'");
      parts.add(dialect.qualify(alias, n));
      parts.add("'" + QUOTE_MARKER + "'");
    }
    parts.add("'}'");
    return "CONCAT(" + String.join(", ", parts) + ")";
  }

  private String label(String alias, String name, boolean root) {
    return dialect.quoteIdent(root ? name : alias + "." + name);
  }

  private static final class Acc {
    final SqlParams params = new SqlParams();
    final JoinAliases aliases = new JoinAliases();
    final List<String> fields = new ArrayList<>();
    final List<String> conditions = new ArrayList<>();
    final List<String> rootOrder = new ArrayList<>();
    final List<String> joinedOrder = new ArrayList<>();
    final List<String> joins = new ArrayList<>();
  }
}
