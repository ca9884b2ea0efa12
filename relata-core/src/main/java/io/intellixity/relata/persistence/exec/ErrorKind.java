package io.intellixity.relata.persistence.exec;

public enum ErrorKind {
  CONNECTION,
  QUERY,
  INSERT,
  UPDATE,
  DELETE,
  INVALID_INPUT,
  /** Requested relation missing from the schema; never recoverable. */
  RELATION_CONFIG
}
