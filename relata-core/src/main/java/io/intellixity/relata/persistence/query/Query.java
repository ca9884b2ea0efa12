package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Structured query against one entity.
 *
 * <p>Built with the {@code withX} methods; compilers only read it.</p>
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private final String entity;
  private List<Selection> selections = new ArrayList<>();
  private QueryElement filter;
  private List<SortField> sort = new ArrayList<>();
  private int limit;
  private int offset;
  private int page;
  private List<RelationRequest> relations = new ArrayList<>();
  private List<Join> joins = new ArrayList<>();

  public Query(String entity) {
    this.entity = Objects.requireNonNull(entity, "entity");
  }

  public static Query from(String entity) { return new Query(entity); }

  public String entity() { return entity; }
  public List<Selection> selections() { return selections; }
  public QueryElement filter() { return filter; }
  public List<SortField> sort() { return sort; }
  /** 0 when unlimited. */
  public int limit() { return limit; }
  public int offset() { return offset; }
  /** 1-based; 0 when unset. */
  public int page() { return page; }
  public List<RelationRequest> relations() { return relations; }
  public List<Join> joins() { return joins; }

  public Query withSelections(List<Selection> selections) { this.selections = new ArrayList<>(selections == null ? List.of() : selections); return this; }
  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public Query withLimit(int limit) { this.limit = Math.max(0, limit); return this; }
  public Query withOffset(int offset) { this.offset = Math.max(0, offset); return this; }
  public Query withPage(int page) { this.page = Math.max(0, page); return this; }
  public Query withRelations(List<RelationRequest> relations) { this.relations = new ArrayList<>(relations == null ? List.of() : relations); return this; }
  public Query withJoins(List<Join> joins) { this.joins = new ArrayList<>(joins == null ? List.of() : joins); return this; }

  public Query select(String... fields) {
    for (String f : fields) selections.add(Selection.column(f));
    return this;
  }

  public Query selectSubQuery(Query sub) { selections.add(Selection.subQuery(sub)); return this; }
  public Query where(QueryElement filter) { return withFilter(filter); }
  public Query orderBy(SortField sortField) { sort.add(sortField); return this; }
  public Query relation(String name, String... fields) { relations.add(RelationRequest.of(name, fields)); return this; }
  public Query join(Join join) { joins.add(join); return this; }

  /** Explicit offset wins; otherwise {@code (page - 1) * limit}. */
  public int effectiveOffset() {
    if (offset > 0) return offset;
    if (page > 0 && limit > 0) return OffsetPage.ofPage(page, limit).offset();
    return 0;
  }

  /** Pagination window, or null when no limit is set. */
  public OffsetPage offsetPage() {
    return limit > 0 ? new OffsetPage(effectiveOffset(), limit) : null;
  }

  /** Plain column names of the explicit field list. */
  public List<String> columnNames() {
    List<String> out = new ArrayList<>();
    for (Selection s : selections) {
      if (s instanceof Selection.Column c) out.add(c.field());
    }
    return out;
  }

  public RelationRequest relationRequest(String name) {
    for (RelationRequest r : relations) {
      if (r.name().equals(name)) return r;
    }
    return null;
  }
}
