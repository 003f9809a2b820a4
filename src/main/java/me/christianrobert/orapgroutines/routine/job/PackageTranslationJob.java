package me.christianrobert.orapgroutines.routine.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.core.job.AbstractTranslationJob;
import me.christianrobert.orapgroutines.core.job.model.JobProgress;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageSource;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import me.christianrobert.orapgroutines.core.job.model.routine.TranslationRunResult;
import me.christianrobert.orapgroutines.transformer.context.TransformationException;
import me.christianrobert.orapgroutines.transformer.context.TranslationContext;
import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.parser.PackageParseResult;
import me.christianrobert.orapgroutines.transformer.service.PackageTranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Batch translation of Oracle packages.
 *
 * The job:
 * 1. Parses every submitted package and resolves its visibility (Pass 1), sequentially,
 *    so the whole run's registry is complete before any routine is emitted
 * 2. Translates the packages concurrently (Pass 2) on a pool sized by
 *    {@code translation.parallelism}
 * 3. Returns one report per package, in submission order
 *
 * Cancellation is checked between packages; a package already being translated finishes.
 */
@Dependent
public class PackageTranslationJob extends AbstractTranslationJob<TranslationRunResult> {

    private static final Logger log = LoggerFactory.getLogger(PackageTranslationJob.class);

    @Inject
    private PackageTranslationService translationService;

    private List<PackageSource> packages = new ArrayList<>();

    public void setPackages(List<PackageSource> packages) {
        this.packages = packages != null ? new ArrayList<>(packages) : new ArrayList<>();
    }

    public List<PackageSource> getPackages() {
        return packages;
    }

    @Override
    protected String getTranslationType() {
        return "PACKAGE_TRANSLATION";
    }

    @Override
    protected TranslationRunResult performTranslation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing",
                String.format("Starting translation of %d packages", packages.size()));

        if (packages.isEmpty()) {
            updateProgress(progressCallback, 90, "No packages", "Nothing to translate");
            return new TranslationRunResult(new ArrayList<>());
        }

        TranslationContext context = translationService.createContext();

        // Pass 1: parse and resolve visibility of every package
        int total = packages.size();
        List<PackageParseResult> parsed = new ArrayList<>(total);
        List<PackageTranslationReport> parseFailures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            checkCancellation();
            PackageSource source = packages.get(i);
            updateProgress(progressCallback, JobProgress.scaled(i, total, 5, 30),
                    "Resolving visibility", source.getDisplayName());

            parsed.add(null);
            parseFailures.add(null);
            try {
                PackageParseResult result = translationService.parse(source);
                translationService.resolveVisibility(result.getOraclePackage(), context);
                parsed.set(i, result);
            } catch (TransformationException e) {
                log.warn("Package {} could not be parsed: {}", source.getDisplayName(), e.getMessage());
                parseFailures.set(i, PackageTranslationReport.packageFailure(
                        source.getDisplayName(), e.getDetailedMessage()));
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("Package {} rejected: {}", source.getDisplayName(), e.getMessage());
                parseFailures.set(i, PackageTranslationReport.packageFailure(
                        source.getDisplayName(), e.getMessage()));
            }
        }
        log.info("Pass 1 complete: {} of {} packages resolved", context.getVisibilityRegistry().getPackageCount(), total);
        List<String> warnings = findSharedTargets(parsed, context);

        // Pass 2: translate routines, packages in parallel
        int parallelism = Math.max(1, configService.getConfigValueAsInt(ConfigService.PARALLELISM, 4));
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, total));
        AtomicInteger completed = new AtomicInteger();
        try {
            List<Future<PackageTranslationReport>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                PackageParseResult result = parsed.get(i);
                if (result == null) {
                    futures.add(null);
                    continue;
                }
                futures.add(executor.submit(() -> {
                    checkCancellation();
                    PackageTranslationReport report = translationService.translatePackage(result, context);
                    int done = completed.incrementAndGet();
                    updateProgress(progressCallback, JobProgress.scaled(done, total, 30, 90),
                            "Translating packages", String.format("%d of %d: %s", done, total,
                                    report.getPackageName()));
                    return report;
                }));
            }

            List<PackageTranslationReport> reports = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                Future<PackageTranslationReport> future = futures.get(i);
                reports.add(future == null ? parseFailures.get(i) : awaitReport(future));
            }
            checkCancellation();
            return new TranslationRunResult(reports, warnings);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Reports packages whose routines land in the same PostgreSQL namespace under the
     * configured naming, where a later CREATE OR REPLACE silently replaces an earlier one.
     */
    private List<String> findSharedTargets(List<PackageParseResult> parsed, TranslationContext context) {
        List<String> warnings = new ArrayList<>();
        Map<String, String> packageByNamespace = new LinkedHashMap<>();
        for (PackageParseResult result : parsed) {
            if (result == null) {
                continue;
            }
            OraclePackage oraclePackage = result.getOraclePackage();
            String namespace = context.getNaming().targetNamespace(oraclePackage.getSchema(), oraclePackage.getName());
            String previous = packageByNamespace.putIfAbsent(namespace, oraclePackage.getQualifiedName());
            if (previous != null && !previous.equals(oraclePackage.getQualifiedName())) {
                String warning = String.format("Packages %s and %s both translate into %s; routines with the same name overwrite each other",
                        previous, oraclePackage.getQualifiedName(), namespace);
                log.warn(warning);
                warnings.add(warning);
            }
        }
        return warnings;
    }

    private PackageTranslationReport awaitReport(Future<PackageTranslationReport> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    @Override
    protected String generateSummaryMessage(TranslationRunResult result) {
        List<String> unresolved = result.getRoutinesWithUnresolvedReferences();
        if (!unresolved.isEmpty()) {
            log.warn("Routines with unresolved cursor attribute references: {}", unresolved);
        }
        String summary = String.format("Translated %d packages: %d routines succeeded, %d failed, %d packages failed",
                result.getPackageCount(), result.getSuccessCount(), result.getFailedCount(),
                result.getFailedPackageCount());
        if (!result.getWarnings().isEmpty()) {
            summary += String.format("; %d warnings", result.getWarnings().size());
        }
        if (!unresolved.isEmpty()) {
            summary += String.format("; %d routines with unresolved attribute references: %s",
                    unresolved.size(), String.join(", ", unresolved));
        }
        return summary;
    }
}
