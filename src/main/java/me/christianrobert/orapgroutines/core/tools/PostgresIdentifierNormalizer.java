package me.christianrobert.orapgroutines.core.tools;

import java.util.Set;

/**
 * Normalizes identifiers (schema, routine, parameter and variable names) for PostgreSQL.
 *
 * <h2>Normalization Strategy</h2>
 * Oracle identifiers are converted using "smart quoting":
 * <ul>
 *   <li>Convert to lowercase (PostgreSQL convention)</li>
 *   <li>Quote identifiers that are PostgreSQL reserved words</li>
 *   <li>Quote identifiers that contain special characters (#, $, etc.)</li>
 *   <li>Leave normal identifiers unquoted for better readability</li>
 * </ul>
 *
 * <h2>Examples</h2>
 * <pre>
 * Oracle Name      →  PostgreSQL Name
 * -----------         ---------------
 * EMP_PKG          →  emp_pkg
 * GET_SALARY       →  get_salary
 * ORDER            →  "order"       (reserved word)
 * CALC$TOTAL       →  "calc$total"  (special character)
 * </pre>
 *
 * @see <a href="https://www.postgresql.org/docs/current/sql-keywords-appendix.html">PostgreSQL Reserved Keywords</a>
 */
public class PostgresIdentifierNormalizer {

    private PostgresIdentifierNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * PostgreSQL reserved keywords that require quoting when used as identifiers.
     * Curated to the words likely to show up as package, routine or parameter names.
     */
    private static final Set<String> POSTGRES_RESERVED_WORDS = Set.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc",
            "asymmetric", "authorization", "between", "binary", "both", "case",
            "cast", "check", "collate", "column", "concurrently", "constraint",
            "create", "cross", "current_date", "current_role", "current_schema",
            "current_time", "current_timestamp", "current_user", "default",
            "deferrable", "desc", "distinct", "do", "else", "end", "except",
            "false", "fetch", "for", "foreign", "freeze", "from", "full", "grant",
            "group", "having", "ilike", "in", "initially", "inner", "intersect",
            "into", "is", "isnull", "join", "lateral", "leading", "left", "like",
            "limit", "localtime", "localtimestamp", "natural", "not", "notnull",
            "null", "offset", "on", "only", "or", "order", "outer", "overlaps",
            "placing", "primary", "references", "returning", "right", "select",
            "session_user", "similar", "some", "symmetric", "table", "tablesample",
            "then", "to", "trailing", "true", "union", "unique", "user", "using",
            "variadic", "verbose", "when", "where", "window", "with"
    );

    /**
     * Normalizes a single identifier for use in PostgreSQL.
     *
     * @param identifier The Oracle identifier (e.g., "EMP_PKG", "ORDER", "CALC$TOTAL")
     * @return The normalized identifier (e.g., "emp_pkg", "\"order\"", "\"calc$total\"")
     */
    public static String normalizeIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }

        String folded = NameNormalizer.normalizeIdentifier(identifier);
        if (needsQuoting(folded)) {
            return "\"" + folded + "\"";
        }
        return folded;
    }

    /**
     * Normalizes a qualified identifier (schema.routine) component by component.
     *
     * <pre>
     * normalizeQualifiedIdentifier("EMP_PKG.GET_SALARY") → emp_pkg.get_salary
     * normalizeQualifiedIdentifier("HR.USER")            → hr."user"
     * </pre>
     */
    public static String normalizeQualifiedIdentifier(String qualifiedIdentifier) {
        if (qualifiedIdentifier == null || qualifiedIdentifier.isEmpty()) {
            return qualifiedIdentifier;
        }

        String[] parts = qualifiedIdentifier.split("\\.");
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                result.append(".");
            }
            result.append(normalizeIdentifier(parts[i]));
        }
        return result.toString();
    }

    /**
     * Checks if an identifier is a PostgreSQL reserved word.
     *
     * @param identifier The identifier to check (case-insensitive)
     */
    public static boolean isReservedWord(String identifier) {
        if (identifier == null) {
            return false;
        }
        return POSTGRES_RESERVED_WORDS.contains(NameNormalizer.normalizeIdentifier(identifier));
    }

    private static boolean needsQuoting(String lowercaseIdentifier) {
        if (POSTGRES_RESERVED_WORDS.contains(lowercaseIdentifier)) {
            return true;
        }
        // Unquoted PostgreSQL identifiers: letter or underscore, then letters, digits, underscores
        return !lowercaseIdentifier.matches("^[a-z_][a-z0-9_]*$");
    }
}
