package me.christianrobert.orapgroutines.core.tools;

import java.util.Locale;

/**
 * Folds Oracle identifiers to a single canonical case for comparisons.
 *
 * Oracle treats unquoted identifiers case-insensitively. Every place that compares
 * routine names, cursor names or package names goes through {@link #normalizeIdentifier}
 * instead of relying on {@code equalsIgnoreCase}, so lookups in maps and sets behave
 * the same everywhere.
 *
 * We work under the assumption that no two objects in the source differ only in
 * case, so quoted identifiers are folded as well.
 */
public class NameNormalizer {

  private NameNormalizer() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Folds an identifier: trims, removes surrounding double quotes, lowercases.
   *
   * Examples:
   * - "EmpCur" -> empcur
   * - EMP_CUR -> emp_cur
   * - emp_cur -> emp_cur
   *
   * @param identifier The original identifier (may include quotes)
   * @return The folded identifier, or null for null input
   */
  public static String normalizeIdentifier(String identifier) {
    if (identifier == null) {
      return null;
    }

    String trimmed = identifier.trim();
    if (isQuoted(trimmed)) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }

    return trimmed.toLowerCase(Locale.ROOT);
  }

  /**
   * Folds every part of a dotted name separately.
   *
   * Examples:
   * - HR."Emp_Pkg" -> hr.emp_pkg
   * - EMP_PKG.C1 -> emp_pkg.c1
   */
  public static String normalizeQualifiedName(String qualifiedName) {
    if (qualifiedName == null) {
      return null;
    }

    String[] parts = qualifiedName.trim().split("\\.");
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        result.append('.');
      }
      result.append(normalizeIdentifier(parts[i]));
    }
    return result.toString();
  }

  /**
   * Checks if an identifier is quoted (surrounded by double quotes).
   */
  public static boolean isQuoted(String identifier) {
    if (identifier == null || identifier.trim().length() < 2) {
      return false;
    }

    String trimmed = identifier.trim();
    return trimmed.startsWith("\"") && trimmed.endsWith("\"");
  }

  /**
   * Case-insensitive identifier comparison via folding.
   */
  public static boolean sameIdentifier(String left, String right) {
    if (left == null || right == null) {
      return left == right;
    }
    return normalizeIdentifier(left).equals(normalizeIdentifier(right));
  }
}
