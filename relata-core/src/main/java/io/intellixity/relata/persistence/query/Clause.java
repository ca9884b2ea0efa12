package io.intellixity.relata.persistence.query;

public enum Clause {
  AND("AND"),
  OR("OR");

  private final String keyword;

  Clause(String keyword) { this.keyword = keyword; }

  public String keyword() { return keyword; }
}
