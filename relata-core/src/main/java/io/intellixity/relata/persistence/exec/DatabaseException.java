package io.intellixity.relata.persistence.exec;

import java.util.Objects;

/** Failure of a public {@link DataEngine} operation, tagged with its {@link ErrorKind}. */
public class DatabaseException extends RuntimeException {
  private final ErrorKind kind;

  public DatabaseException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DatabaseException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }

  public static DatabaseException invalidInput(String message) {
    return new DatabaseException(ErrorKind.INVALID_INPUT, message);
  }
}
