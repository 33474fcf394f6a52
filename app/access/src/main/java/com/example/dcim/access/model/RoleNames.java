package com.example.dcim.access.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/** Role codes are compared upper-cased and trimmed; blanks never name a role. */
public final class RoleNames {
  private RoleNames() {}

  public static String normalize(String roleName) {
    if (roleName == null || roleName.isBlank()) {
      return null;
    }
    return roleName.trim().toUpperCase(Locale.ROOT);
  }

  public static Set<String> normalizeAll(Collection<String> roleNames) {
    final Set<String> normalized = new TreeSet<>();
    if (roleNames == null) {
      return Set.copyOf(normalized);
    }
    for (String roleName : roleNames) {
      final String value = normalize(roleName);
      if (value != null) {
        normalized.add(value);
      }
    }
    return Set.copyOf(normalized);
  }
}
