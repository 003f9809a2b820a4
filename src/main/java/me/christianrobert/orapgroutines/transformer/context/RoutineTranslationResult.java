package me.christianrobert.orapgroutines.transformer.context;

import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of translating one routine.
 * Contains either the PL/pgSQL text (with the access revocation for private routines)
 * or an error message, plus the attribute rewrite counts.
 */
public class RoutineTranslationResult {

    private final String routineName;
    private final String targetName;
    private final RoutineVisibility visibility;
    private final boolean success;
    private final String postgresSql;
    private final String errorMessage;
    private final int rewrittenReferenceCount;
    private final List<String> unresolvedReferences;

    private RoutineTranslationResult(String routineName, String targetName, RoutineVisibility visibility,
                                     boolean success, String postgresSql, String errorMessage,
                                     int rewrittenReferenceCount, List<String> unresolvedReferences) {
        this.routineName = routineName;
        this.targetName = targetName;
        this.visibility = visibility;
        this.success = success;
        this.postgresSql = postgresSql;
        this.errorMessage = errorMessage;
        this.rewrittenReferenceCount = rewrittenReferenceCount;
        this.unresolvedReferences = Collections.unmodifiableList(new ArrayList<>(unresolvedReferences));
    }

    /**
     * Creates a successful translation result.
     */
    public static RoutineTranslationResult success(String routineName, String targetName,
                                                   RoutineVisibility visibility, String postgresSql,
                                                   int rewrittenReferenceCount,
                                                   List<String> unresolvedReferences) {
        return new RoutineTranslationResult(routineName, targetName, visibility, true, postgresSql, null,
                rewrittenReferenceCount, unresolvedReferences);
    }

    /**
     * Creates a failed translation result.
     */
    public static RoutineTranslationResult failure(String routineName, RoutineVisibility visibility,
                                                   String errorMessage) {
        return new RoutineTranslationResult(routineName, null, visibility, false, null, errorMessage,
                0, Collections.emptyList());
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static RoutineTranslationResult failure(String routineName, RoutineVisibility visibility,
                                                   TransformationException exception) {
        return failure(routineName, visibility, exception.getDetailedMessage());
    }

    public String getRoutineName() {
        return routineName;
    }

    /** PostgreSQL name of the emitted routine, null on failure */
    public String getTargetName() {
        return targetName;
    }

    public RoutineVisibility getVisibility() {
        return visibility;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPostgresSql() {
        return postgresSql;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getRewrittenReferenceCount() {
        return rewrittenReferenceCount;
    }

    /** Attribute references left untranslated, as written (e.g. "x%ROWCOUNT") */
    public List<String> getUnresolvedReferences() {
        return unresolvedReferences;
    }

    public int getUnresolvedReferenceCount() {
        return unresolvedReferences.size();
    }

    @Override
    public String toString() {
        if (success) {
            return "RoutineTranslationResult{" + routineName + ", success=true, visibility=" + visibility
                    + ", rewritten=" + rewrittenReferenceCount
                    + ", unresolved=" + unresolvedReferences.size() + "}";
        } else {
            return "RoutineTranslationResult{" + routineName + ", success=false, error='" + errorMessage + "'}";
        }
    }
}
