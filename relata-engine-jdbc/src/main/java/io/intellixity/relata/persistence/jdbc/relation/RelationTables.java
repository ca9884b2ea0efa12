package io.intellixity.relata.persistence.jdbc.relation;

import io.intellixity.relata.persistence.util.Names;

/** Names of the side tables that back many-to-many, list and multilingual fields. */
public final class RelationTables {
  public static final String ID = "id";
  public static final String LIST_FK = "fk";
  public static final String LIST_VALUE = "value";
  public static final String LANG = "lang";

  private RelationTables() {}

  /** {@code Post.tags -> PostHasTags}. */
  public static String junction(String owner, String field) {
    return owner + "Has" + Names.pascal(field);
  }

  /** {@code Post.keywords -> PostKeywordsList}. */
  public static String list(String entity, String field) {
    return entity + Names.pascal(field) + "List";
  }

  public static String translation(String entity) {
    return entity + "_translation";
  }

  /** Key columns of {@code owner}'s junction towards {@code related}. */
  public static JunctionColumns junctionColumns(String owner, String related) {
    String ownerCol = Names.camel(owner);
    String relatedCol = Names.camel(related);
    if (ownerCol.equals(relatedCol)) relatedCol = relatedCol + "Related";
    return new JunctionColumns(ownerCol, relatedCol);
  }

  public record JunctionColumns(String owner, String related) {}
}
