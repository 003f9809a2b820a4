package me.christianrobert.orapgroutines.core.tools;

/**
 * Removes PL/SQL comments from source code while preserving string literals.
 *
 * <p>Run this before boundary scanning or tokenizing: neither the scanner nor the
 * tokenizer handle comments, which keeps their state machines small.
 * Line comments keep their terminating newline so line structure survives.
 */
public class CodeCleaner {

  private CodeCleaner() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  public static String removeComments(String plsqlCode) {
    if (plsqlCode == null) {
      return null;
    }

    StringBuilder result = new StringBuilder(plsqlCode.length());
    boolean inSingleQuote = false;
    boolean inLineComment = false;
    boolean inBlockComment = false;

    for (int i = 0; i < plsqlCode.length(); i++) {
      char currentChar = plsqlCode.charAt(i);
      char nextChar = (i + 1 < plsqlCode.length()) ? plsqlCode.charAt(i + 1) : '\0';

      if (inLineComment) {
        if (currentChar == '\n') {
          inLineComment = false;
          result.append(currentChar);
        }
        continue;
      }

      if (inBlockComment) {
        if (currentChar == '*' && nextChar == '/') {
          inBlockComment = false;
          i++;
        }
        continue;
      }

      if (inSingleQuote) {
        result.append(currentChar);
        if (currentChar == '\'') {
          // '' is an escaped quote, not the end of the literal
          if (nextChar == '\'') {
            result.append(nextChar);
            i++;
          } else {
            inSingleQuote = false;
          }
        }
        continue;
      }

      if (currentChar == '-' && nextChar == '-') {
        inLineComment = true;
        i++;
        continue;
      }

      if (currentChar == '/' && nextChar == '*') {
        inBlockComment = true;
        i++;
        continue;
      }

      if (currentChar == '\'') {
        inSingleQuote = true;
      }
      result.append(currentChar);
    }

    return result.toString();
  }
}
