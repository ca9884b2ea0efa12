package io.intellixity.relata.persistence.jdbc.compile;

import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.query.*;
import io.intellixity.relata.persistence.schema.FieldDef;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a condition tree into a WHERE fragment over one table alias.
 *
 * <ul>
 *   <li>leaf: {@code (alias.field op :bN)}, or {@code alias.other} on the right for field comparisons</li>
 *   <li>a leaf on an undeclared field, or on a field without a column, renders as ""</li>
 *   <li>groups drop blank children; an all-blank group renders as ""; a single survivor is returned unwrapped</li>
 * </ul>
 */
public final class ConditionCompiler {
  private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;

  public ConditionCompiler(SchemaRegistry schemas, JdbcDialect dialect) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public String compile(String entity, QueryElement el, String alias, SqlParams params) {
    if (el == null) return "";

    if (el instanceof LogicalGroup g) {
      List<String> children = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = compile(entity, c, alias, params);
        if (!s.isBlank()) children.add(s);
      }
      if (children.isEmpty()) return "";
      if (children.size() == 1) return children.get(0);
      return "(" + String.join(" " + g.clause().keyword() + " ", children) + ")";
    }

    if (el instanceof Condition c) return leaf(entity, c, alias, params);

    throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
  }

  private String leaf(String entity, Condition c, String alias, SqlParams params) {
    String target = c.entity() == null ? entity : c.entity();
    FieldDef f = columnField(target, c.field());
    if (f == null) {
      if (log.isDebugEnabled()) log.debug("relata.condition skipped entity={} field={}", target, c.field());
      return "";
    }
    String lhs = dialect.qualify(alias, f.name());

    if (c.valueIsField()) {
      FieldDef other = columnField(target, (String) c.value());
      if (other == null) return "";
      return "(" + lhs + " " + c.operator().symbol() + " " + dialect.qualify(alias, other.name()) + ")";
    }

    Object value = c.value();
    if (value instanceof Map<?, ?> m) value = m.get(relatedKey(f));

    if (value == null && c.operator() == Operator.EQ) return "(" + lhs + " IS NULL)";
    if (value == null && c.operator() == Operator.NE) return "(" + lhs + " IS NOT NULL)";

    return "(" + lhs + " " + c.operator().symbol() + " " + params.add(value, f.type()) + ")";
  }

  private FieldDef columnField(String entity, String field) {
    if (!schemas.entityNames().contains(entity)) return null;
    FieldDef f = schemas.getField(entity, field);
    return (f == null || !f.hasColumn()) ? null : f;
  }

  /** Key read from an object value: the related primary key for relations, else "id". */
  private String relatedKey(FieldDef f) {
    return f.isRelation() ? schemas.primaryKeyField(f.relation().targetEntity()) : "id";
  }
}
