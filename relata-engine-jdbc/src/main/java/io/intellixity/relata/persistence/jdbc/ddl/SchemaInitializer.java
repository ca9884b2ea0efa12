package io.intellixity.relata.persistence.jdbc.ddl;

import io.intellixity.relata.persistence.jdbc.JdbcGateway;
import io.intellixity.relata.persistence.jdbc.SqlParams;
import io.intellixity.relata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.relata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.persistence.jdbc.relation.RelationTables;
import io.intellixity.relata.persistence.schema.*;
import io.intellixity.relata.persistence.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drops and recreates every table the registry implies: one per entity, plus translation,
 * junction and list tables. Existing data is lost.
 */
public final class SchemaInitializer {
  private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

  private static final FieldDef ID = FieldDef.builder(RelationTables.ID, FieldType.INTEGER).primary().build();
  private static final FieldDef LANG = FieldDef.builder(RelationTables.LANG, FieldType.STRING).maxLength(8).required().build();

  private final SchemaRegistry schemas;
  private final JdbcDialect dialect;
  private final JdbcGateway gateway;

  public SchemaInitializer(SchemaRegistry schemas, JdbcDialect dialect, JdbcGateway gateway) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  public void initialize() {
    List<String> ddl = statements();
    for (String sql : ddl) gateway.execute(SqlParams.noParams(sql, ExecKind.UPDATE), null);
    log.info("relata.ddl dialect={} entities={} statements={}", dialect.id(), schemas.entityNames().size(), ddl.size());
  }

  /** DROP and CREATE statements in execution order. */
  public List<String> statements() {
    List<String> out = new ArrayList<>();
    for (String entity : schemas.entityNames()) {
      EntitySchema s = schemas.getSchema(entity);
      entityTable(s, out);

      List<FieldDef> multilingual = s.fields().values().stream().filter(FieldDef::multilingual).toList();
      if (!multilingual.isEmpty()) translationTable(s, multilingual, out);

      for (FieldDef f : s.fields().values()) {
        if (f.isRelation(RelationKind.MANY_TO_MANY)) junctionTable(s, f, out);
        else if (f.isList()) listTable(s, f, out);
      }
    }
    return out;
  }

  private void entityTable(EntitySchema s, List<String> out) {
    String pk = s.primaryKey();
    List<String> columns = new ArrayList<>();
    if (s.field(pk) == null) columns.add(column(ID));
    for (FieldDef f : s.fields().values()) {
      if (f.hasColumn()) columns.add(column(f));
    }
    create(s.name(), columns, pk, out);
  }

  private void translationTable(EntitySchema s, List<FieldDef> multilingual, List<String> out) {
    List<String> columns = new ArrayList<>();
    columns.add(column(ID));
    columns.add(dialect.quoteIdent(Names.camel(s.name())) + " " + dialect.scalarType(FieldType.RELATION) + " NOT NULL");
    columns.add(column(LANG));
    for (FieldDef f : multilingual) columns.add(dialect.quoteIdent(f.name()) + " " + dialect.columnType(f));
    create(RelationTables.translation(s.name()), columns, RelationTables.ID, out);
  }

  private void junctionTable(EntitySchema s, FieldDef f, List<String> out) {
    var jc = RelationTables.junctionColumns(s.name(), f.relation().targetEntity());
    String integer = dialect.scalarType(FieldType.INTEGER);
    create(RelationTables.junction(s.name(), f.name()), List.of(
        column(ID),
        dialect.quoteIdent(jc.owner()) + " " + integer + " NOT NULL",
        dialect.quoteIdent(jc.related()) + " " + integer + " NOT NULL"), RelationTables.ID, out);
  }

  private void listTable(EntitySchema s, FieldDef f, List<String> out) {
    create(RelationTables.list(s.name(), f.name()), List.of(
        column(ID),
        dialect.quoteIdent(RelationTables.LIST_FK) + " " + dialect.scalarType(FieldType.INTEGER) + " NOT NULL",
        dialect.quoteIdent(RelationTables.LIST_VALUE) + " " + dialect.scalarType(f.listElementType())), RelationTables.ID, out);
  }

  private void create(String table, List<String> columns, String pk, List<String> out) {
    out.add(dialect.dropTableIfExists(table));
    out.add("CREATE TABLE " + dialect.quoteIdent(table) + " (" + String.join(", ", columns)
        + ", PRIMARY KEY (" + dialect.quoteIdent(pk) + "))");
  }

  private String column(FieldDef f) {
    StringBuilder sb = new StringBuilder(dialect.quoteIdent(f.name())).append(' ').append(dialect.columnType(f));
    if (f.primary() && (f.type() == FieldType.INTEGER || f.type().isStringLike())) sb.append(' ').append(dialect.identityClause());
    if (f.primary() || (f.required() && !f.isRelation())) sb.append(" NOT NULL");
    if (!f.primary() && f.defaultValue() != null) sb.append(" DEFAULT ").append(dialect.literal(f.defaultValue()));
    if (!f.primary() && f.unique()) sb.append(" UNIQUE");
    return sb.toString();
  }
}
