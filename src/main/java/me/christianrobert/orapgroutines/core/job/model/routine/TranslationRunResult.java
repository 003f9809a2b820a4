package me.christianrobert.orapgroutines.core.job.model.routine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a batch translation run: one report per submitted package, in submission order.
 */
public class TranslationRunResult {
    private final List<PackageTranslationReport> reports;
    private final List<String> warnings;

    public TranslationRunResult(List<PackageTranslationReport> reports) {
        this(reports, Collections.emptyList());
    }

    public TranslationRunResult(List<PackageTranslationReport> reports, List<String> warnings) {
        this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<PackageTranslationReport> getReports() {
        return reports;
    }

    /** Run-level problems that do not fail a package, such as two packages sharing a target schema */
    public List<String> getWarnings() {
        return warnings;
    }

    public int getPackageCount() {
        return reports.size();
    }

    public int getFailedPackageCount() {
        int count = 0;
        for (PackageTranslationReport report : reports) {
            if (report.isPackageFailed()) {
                count++;
            }
        }
        return count;
    }

    public int getRoutineCount() {
        int count = 0;
        for (PackageTranslationReport report : reports) {
            count += report.getRoutineCount();
        }
        return count;
    }

    public int getSuccessCount() {
        int count = 0;
        for (PackageTranslationReport report : reports) {
            count += report.getSuccessCount();
        }
        return count;
    }

    public int getFailedCount() {
        int count = 0;
        for (PackageTranslationReport report : reports) {
            count += report.getFailedCount();
        }
        return count;
    }

    public int getUnresolvedReferenceCount() {
        int count = 0;
        for (PackageTranslationReport report : reports) {
            count += report.getUnresolvedReferenceCount();
        }
        return count;
    }

    /**
     * Qualified names ("package.routine") of routines with unresolved attribute references.
     */
    public List<String> getRoutinesWithUnresolvedReferences() {
        List<String> names = new ArrayList<>();
        for (PackageTranslationReport report : reports) {
            report.getRoutinesWithUnresolvedReferences()
                    .forEach(result -> names.add(report.getPackageName() + "." + result.getRoutineName()));
        }
        return names;
    }

    public boolean isSuccessful() {
        return getFailedPackageCount() == 0 && getFailedCount() == 0;
    }

    @Override
    public String toString() {
        return String.format("TranslationRunResult{packages=%d, routines=%d, success=%d, failed=%d, unresolved=%d}",
                getPackageCount(), getRoutineCount(), getSuccessCount(), getFailedCount(),
                getUnresolvedReferenceCount());
    }
}
