package io.intellixity.relata.persistence.query;

import io.intellixity.relata.persistence.exec.DatabaseException;

/** Rows {@code [offset, offset + limit)} of an ordered result. */
public record OffsetPage(int offset, int limit) {
  public OffsetPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0, got " + limit);
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
  }

  /**
   * One-based page number to a window; page 0 means the first page.
   *
   * @throws DatabaseException INVALID_INPUT when the offset does not fit an int
   */
  public static OffsetPage ofPage(int page, int limit) {
    if (page <= 1) return new OffsetPage(0, limit);
    try {
      return new OffsetPage(Math.multiplyExact(page - 1, limit), limit);
    } catch (ArithmeticException e) {
      throw DatabaseException.invalidInput("page " + page + " with limit " + limit + " is past the largest offset");
    }
  }
}
