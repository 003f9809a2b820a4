package me.christianrobert.orapgroutines.core.job.model.routine;

import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of translating one package: per-routine results in body order plus totals.
 * A package that could not be parsed at all carries only a package error.
 */
public class PackageTranslationReport {
    private final String packageName;
    private final boolean hasSpec;
    private final Set<String> publicRoutineNames;
    private final List<RoutineTranslationResult> routineResults;
    private final String packageError;

    public PackageTranslationReport(String packageName, boolean hasSpec, Set<String> publicRoutineNames,
                                    List<RoutineTranslationResult> routineResults) {
        this(packageName, hasSpec, publicRoutineNames, routineResults, null);
    }

    private PackageTranslationReport(String packageName, boolean hasSpec, Set<String> publicRoutineNames,
                                     List<RoutineTranslationResult> routineResults, String packageError) {
        this.packageName = packageName;
        this.hasSpec = hasSpec;
        this.publicRoutineNames = Collections.unmodifiableSet(new TreeSet<>(publicRoutineNames));
        this.routineResults = Collections.unmodifiableList(new ArrayList<>(routineResults));
        this.packageError = packageError;
    }

    /**
     * Report for a package whose source could not be turned into a unit model.
     */
    public static PackageTranslationReport packageFailure(String packageName, String error) {
        return new PackageTranslationReport(packageName, false, Collections.emptySet(),
                Collections.emptyList(), error);
    }

    public String getPackageName() {
        return packageName;
    }

    public boolean isHasSpec() {
        return hasSpec;
    }

    public Set<String> getPublicRoutineNames() {
        return publicRoutineNames;
    }

    public List<RoutineTranslationResult> getRoutineResults() {
        return routineResults;
    }

    public String getPackageError() {
        return packageError;
    }

    public boolean isPackageFailed() {
        return packageError != null;
    }

    public int getRoutineCount() {
        return routineResults.size();
    }

    public int getPublicCount() {
        return countVisibility(RoutineVisibility.PUBLIC);
    }

    public int getPrivateCount() {
        return countVisibility(RoutineVisibility.PRIVATE);
    }

    public int getSuccessCount() {
        int count = 0;
        for (RoutineTranslationResult result : routineResults) {
            if (result.isSuccess()) {
                count++;
            }
        }
        return count;
    }

    public int getFailedCount() {
        return routineResults.size() - getSuccessCount();
    }

    public int getRewrittenReferenceCount() {
        int count = 0;
        for (RoutineTranslationResult result : routineResults) {
            count += result.getRewrittenReferenceCount();
        }
        return count;
    }

    public int getUnresolvedReferenceCount() {
        int count = 0;
        for (RoutineTranslationResult result : routineResults) {
            count += result.getUnresolvedReferenceCount();
        }
        return count;
    }

    /**
     * Routines that translated but still contain attribute references on unknown cursors.
     */
    public List<RoutineTranslationResult> getRoutinesWithUnresolvedReferences() {
        List<RoutineTranslationResult> flagged = new ArrayList<>();
        for (RoutineTranslationResult result : routineResults) {
            if (result.getUnresolvedReferenceCount() > 0) {
                flagged.add(result);
            }
        }
        return flagged;
    }

    public List<RoutineTranslationResult> getFailedRoutines() {
        List<RoutineTranslationResult> failed = new ArrayList<>();
        for (RoutineTranslationResult result : routineResults) {
            if (result.isFailure()) {
                failed.add(result);
            }
        }
        return failed;
    }

    /**
     * Result for a routine by name (case-insensitive); the first one for overloads.
     */
    public RoutineTranslationResult getRoutineResult(String routineName) {
        for (RoutineTranslationResult result : routineResults) {
            if (result.getRoutineName().equalsIgnoreCase(routineName)) {
                return result;
            }
        }
        return null;
    }

    private int countVisibility(RoutineVisibility visibility) {
        int count = 0;
        for (RoutineTranslationResult result : routineResults) {
            if (result.getVisibility() == visibility) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        if (isPackageFailed()) {
            return String.format("PackageTranslationReport{%s, failed: %s}", packageName, packageError);
        }
        return String.format("PackageTranslationReport{%s, public=%d, private=%d, success=%d, failed=%d, "
                        + "rewritten=%d, unresolved=%d}",
                packageName, getPublicCount(), getPrivateCount(), getSuccessCount(), getFailedCount(),
                getRewrittenReferenceCount(), getUnresolvedReferenceCount());
    }
}
