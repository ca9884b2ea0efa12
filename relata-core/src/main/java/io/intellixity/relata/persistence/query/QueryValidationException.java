package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.exec.DatabaseException;
import io.intellixity.relata.persistence.exec.ErrorKind;

/**
 * Raised when a Query references relations or join fields the schema does not declare.
 * <p>
 * This is a programming error and is never downgraded to an empty result.
 */
public final class QueryValidationException extends DatabaseException {
  public QueryValidationException(String message) {
    super(ErrorKind.RELATION_CONFIG, message);
  }
}
