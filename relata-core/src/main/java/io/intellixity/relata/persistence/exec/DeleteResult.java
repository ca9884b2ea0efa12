package io.intellixity.relata.persistence.exec;

import java.util.List;

/** Primary keys of the removed rows. */
public record DeleteResult(List<Object> ids) {
  public DeleteResult {
    ids = ids == null ? List.of() : List.copyOf(ids);
  }

  public static DeleteResult empty() { return new DeleteResult(List.of()); }
}
