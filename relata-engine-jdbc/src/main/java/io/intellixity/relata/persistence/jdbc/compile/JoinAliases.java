package io.intellixity.relata.persistence.jdbc.compile;

import java.util.HashSet;
import java.util.Set;

/** Alias allocation for one compilation: the base name, or {@code base_2}, {@code base_3}... on collision. */
final class JoinAliases {
  private final Set<String> used = new HashSet<>();

  void reserve(String alias) {
    used.add(alias);
  }

  String allocate(String base) {
    if (used.add(base)) return base;
    for (int n = 2; ; n++) {
      String candidate = base + "_" + n;
      if (used.add(candidate)) return candidate;
    }
  }
}
