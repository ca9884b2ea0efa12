package io.intellixity.relata.persistence.query;

import java.util.ArrayList;
import java.util.List;

/** Options accepted by the id/values shortcuts of {@code DataEngine}. */
public final class QueryOptions {
  private final List<String> fields = new ArrayList<>();
  private final List<RelationRequest> relations = new ArrayList<>();
  private final List<SortField> sort = new ArrayList<>();
  private int limit;
  private int offset;
  private int page;

  public static QueryOptions none() { return new QueryOptions(); }

  public QueryOptions fields(String... names) { fields.addAll(List.of(names)); return this; }
  public QueryOptions relation(String name, String... relationFields) { relations.add(RelationRequest.of(name, relationFields)); return this; }
  public QueryOptions orderBy(SortField f) { sort.add(f); return this; }
  public QueryOptions limit(int limit) { this.limit = limit; return this; }
  public QueryOptions offset(int offset) { this.offset = offset; return this; }
  public QueryOptions page(int page) { this.page = page; return this; }

  public List<String> fields() { return fields; }
  public List<RelationRequest> relations() { return relations; }
  public List<SortField> sort() { return sort; }
  public int limit() { return limit; }
  public int offset() { return offset; }
  public int page() { return page; }

  /** Copies the options onto {@code q}; a limit already set on {@code q} wins over none here. */
  public Query applyTo(Query q) {
    if (!fields.isEmpty()) q.select(fields.toArray(String[]::new));
    q.withRelations(relations).withSort(sort).withOffset(offset).withPage(page);
    if (limit > 0) q.withLimit(limit);
    return q;
  }
}
