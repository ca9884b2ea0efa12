package io.intellixity.relata.persistence.query;

/** Node of a filter tree: a {@link Condition} leaf or a {@link LogicalGroup} connector. */
public interface QueryElement {
}
