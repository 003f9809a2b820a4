package me.christianrobert.orapgroutines.core.tools;

import java.util.Locale;

/**
 * Maps Oracle PL/SQL data types to PostgreSQL types for routine headers and declarations.
 *
 * Anchored types ({@code emp.sal%TYPE}, {@code emp%ROWTYPE}) are valid PL/pgSQL as well
 * and pass through lowercased, as do unknown (user-defined) type names.
 */
public class TypeConverter {

  private TypeConverter() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  public static String toPostgre(String oracleType) {
    if (oracleType == null) {
      return null;
    }

    String type = oracleType.toLowerCase(Locale.ROOT).trim();

    if (type.endsWith("%type") || type.endsWith("%rowtype")) {
      return type;
    }

    // Parameterized types first
    if (isBaseType(type, "number")) {
      return "numeric";
    }
    if (isBaseType(type, "varchar2") || isBaseType(type, "nvarchar2")) {
      return "text";
    }
    if (isBaseType(type, "nchar") || isBaseType(type, "char")) {
      return "text";
    }
    if (isBaseType(type, "raw")) {
      return "bytea";
    }
    if (isBaseType(type, "timestamp")) {
      return type.contains("time zone") ? "timestamp with time zone" : "timestamp";
    }
    if (isBaseType(type, "interval")) {
      return "interval";
    }

    switch (type) {
      case "binary_integer":
      case "pls_integer":
      case "natural":
      case "naturaln":
      case "positive":
      case "positiven":
      case "simple_integer":
      case "integer":
      case "int":
        return "integer";

      case "signtype":
      case "smallint":
        return "smallint";

      case "binary_float":
      case "float":
      case "real":
        return "real";

      case "binary_double":
      case "double precision":
        return "double precision";

      case "dec":
      case "decimal":
        return "decimal";

      case "long":
      case "string":
      case "varchar":
      case "clob":
      case "nclob":
      case "rowid":
      case "urowid":
        return "text";

      case "boolean":
        return "boolean";

      case "date":
        return "timestamp";

      case "blob":
      case "long raw":
        return "bytea";

      case "xmltype":
        return "xml";

      case "sys_refcursor":
        return "refcursor";

      case "json":
        return "jsonb";

      default:
        return type;
    }
  }

  /**
   * The keyword on its own, or followed by a length/precision or a modifier
   * ({@code number(10)}, {@code timestamp with time zone}). {@code number_tab} is not.
   */
  private static boolean isBaseType(String type, String keyword) {
    if (!type.startsWith(keyword)) {
      return false;
    }
    if (type.length() == keyword.length()) {
      return true;
    }
    char next = type.charAt(keyword.length());
    return next == '(' || next == ' ';
  }
}
