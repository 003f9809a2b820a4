package me.christianrobert.orapgroutines.transformer.emit;

import me.christianrobert.orapgroutines.core.tools.PostgresIdentifierNormalizer;

import java.util.Locale;

/**
 * How a package routine is named in PostgreSQL, which has no packages.
 */
public enum RoutineNaming {

    /** One schema per package: {@code emp_pkg.get_salary} */
    SCHEMA_PER_PACKAGE,

    /** Package folded into the routine name: {@code hr.emp_pkg__get_salary} */
    FLATTENED;

    public static final RoutineNaming DEFAULT = SCHEMA_PER_PACKAGE;

    public static boolean isKnownMode(String mode) {
        if (mode == null) {
            return false;
        }
        for (RoutineNaming naming : values()) {
            if (naming.name().equals(mode.trim().toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses a configured mode; blank means the default.
     *
     * @throws IllegalArgumentException for an unknown mode
     */
    public static RoutineNaming fromConfig(String mode) {
        if (mode == null || mode.isBlank()) {
            return DEFAULT;
        }
        if (!isKnownMode(mode)) {
            throw new IllegalArgumentException("Unknown naming mode: " + mode);
        }
        return valueOf(mode.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Target name of a routine, normalized for PostgreSQL.
     *
     * @param schema      owning schema, may be null
     * @param packageName owning package
     * @param routineName routine name
     */
    public String qualifiedName(String schema, String packageName, String routineName) {
        switch (this) {
            case FLATTENED: {
                String flattened = PostgresIdentifierNormalizer.normalizeIdentifier(
                        unquote(packageName) + "__" + unquote(routineName));
                if (schema == null || schema.isBlank()) {
                    return flattened;
                }
                return PostgresIdentifierNormalizer.normalizeIdentifier(schema) + "." + flattened;
            }
            case SCHEMA_PER_PACKAGE:
            default:
                return PostgresIdentifierNormalizer.normalizeIdentifier(packageName) + "."
                        + PostgresIdentifierNormalizer.normalizeIdentifier(routineName);
        }
    }

    /**
     * The part of {@link #qualifiedName} that all routines of one package share. Packages
     * with the same namespace overwrite each other's routines of the same name; in
     * SCHEMA_PER_PACKAGE mode this happens to {@code hr.emp_pkg} and {@code sales.emp_pkg}.
     */
    public String targetNamespace(String schema, String packageName) {
        if (this == FLATTENED) {
            String prefix = unquote(packageName).toLowerCase(Locale.ROOT) + "__";
            if (schema == null || schema.isBlank()) {
                return prefix;
            }
            return PostgresIdentifierNormalizer.normalizeIdentifier(schema) + "." + prefix;
        }
        return PostgresIdentifierNormalizer.normalizeIdentifier(packageName);
    }

    private static String unquote(String identifier) {
        String trimmed = identifier.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
