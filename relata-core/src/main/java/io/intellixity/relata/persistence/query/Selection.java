package io.intellixity.relata.persistence.query;

import java.util.Objects;

/** Entry of an explicit field list: a plain column or an embedded sub-query. */
public sealed interface Selection permits Selection.Column, Selection.SubQuery {

  static Column column(String field) { return new Column(field); }

  static SubQuery subQuery(Query query) { return new SubQuery(query); }

  record Column(String field) implements Selection {
    public Column {
      Objects.requireNonNull(field, "field");
    }
  }

  /** Single-row JSON snapshot of {@code query}'s entity, labelled with its camel-cased name. */
  record SubQuery(Query query) implements Selection {
    public SubQuery {
      Objects.requireNonNull(query, "query");
    }
  }
}
