package io.intellixity.relata.persistence.query;

public enum Operator {
  EQ("="),
  NE("<>"),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  /** SQL comparison symbol. */
  public String symbol() {
    return symbol;
  }
}
