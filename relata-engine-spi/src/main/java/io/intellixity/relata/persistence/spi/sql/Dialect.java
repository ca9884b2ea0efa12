package io.intellixity.relata.persistence.spi.sql;

/** Backend-agnostic SPI: identifies a SQL flavour and how it quotes identifiers. */
public interface Dialect {
  String id();

  String quoteIdent(String ident);
}
