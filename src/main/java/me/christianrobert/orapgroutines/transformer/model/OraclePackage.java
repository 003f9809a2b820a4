package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A PL/SQL package: routine declarations from the spec and routine definitions
 * (plus package-level cursors) from the body.
 *
 * <p>Lifecycle: built once per translation unit, read-only afterwards, dropped when
 * the package's translation completes.
 */
public class OraclePackage {

    private final String schema;
    private final String name;
    private final boolean hasSpec;
    private final List<RoutineSignature> specRoutines;
    private final List<RoutineDefinition> bodyRoutines;
    private final List<CursorDeclaration> packageCursors;

    public OraclePackage(String schema, String name, boolean hasSpec,
                         List<RoutineSignature> specRoutines,
                         List<RoutineDefinition> bodyRoutines,
                         List<CursorDeclaration> packageCursors) {
        this.schema = schema;
        this.name = name;
        this.hasSpec = hasSpec;
        this.specRoutines = immutable(specRoutines);
        this.bodyRoutines = immutable(bodyRoutines);
        this.packageCursors = immutable(packageCursors);
    }

    private static <T> List<T> immutable(List<T> list) {
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /** False when the package has a body but no spec */
    public boolean hasSpec() {
        return hasSpec;
    }

    public List<RoutineSignature> getSpecRoutines() {
        return specRoutines;
    }

    public List<RoutineDefinition> getBodyRoutines() {
        return bodyRoutines;
    }

    public List<CursorDeclaration> getPackageCursors() {
        return packageCursors;
    }

    /**
     * Key identifying this package within a translation run.
     * Format: "schema.package" (folded); just "package" without schema.
     */
    public String getPackageKey() {
        String qualified = schema == null || schema.isBlank() ? name : schema + "." + name;
        return NameNormalizer.normalizeQualifiedName(qualified);
    }

    /** Schema-qualified name as written, e.g. "hr.emp_pkg" */
    public String getQualifiedName() {
        return schema == null || schema.isBlank() ? name : schema + "." + name;
    }

    @Override
    public String toString() {
        return "OraclePackage{" + getQualifiedName()
                + ", hasSpec=" + hasSpec
                + ", specRoutines=" + specRoutines.size()
                + ", bodyRoutines=" + bodyRoutines.size()
                + ", packageCursors=" + packageCursors.size() + "}";
    }
}
