package me.christianrobert.orapgroutines.core.job;

import jakarta.inject.Inject;
import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.core.job.exception.JobCancelledException;
import me.christianrobert.orapgroutines.core.job.model.JobProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Abstract base class for translation jobs providing common functionality.
 * This class handles job identity, progress tracking, cancellation and error handling.
 *
 * @param <T> The type of result being produced by the translation
 */
public abstract class AbstractTranslationJob<T> implements Job<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractTranslationJob.class);

    protected final String jobId;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    @Inject
    protected ConfigService configService;

    protected AbstractTranslationJob() {
        this.jobId = generateJobId();
    }

    protected String generateJobId() {
        return getTranslationType().toLowerCase(Locale.ROOT).replace("_", "-") + "-" + UUID.randomUUID();
    }

    /**
     * Identifier of the translation performed, e.g. "PACKAGE_TRANSLATION".
     */
    protected abstract String getTranslationType();

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return getTranslationType();
    }

    @Override
    public String getDescription() {
        return String.format("Perform %s", getTranslationType().replace("_", " ").toLowerCase(Locale.ROOT));
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested for job {}", jobId);
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public CompletableFuture<T> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return performTranslationWithSummary(progressCallback);
            } catch (JobCancelledException e) {
                log.info("{} job {} cancelled", getTranslationType(), jobId);
                throw e;
            } catch (Exception e) {
                log.error("{} operation failed", getTranslationType(), e);
                throw new RuntimeException(String.format("%s operation failed: %s",
                        getTranslationType(), e.getMessage()), e);
            }
        });
    }

    /**
     * Template method for performing the actual translation.
     */
    protected abstract T performTranslation(Consumer<JobProgress> progressCallback) throws Exception;

    /**
     * Template method that provides common flow: translate, then report the summary.
     */
    protected final T performTranslationWithSummary(Consumer<JobProgress> progressCallback) throws Exception {
        T result = performTranslation(progressCallback);

        updateProgress(progressCallback, 95, "Preparing summary", "Generating translation summary");
        String summaryMessage = generateSummaryMessage(result);
        updateProgress(progressCallback, 100, "Completed", summaryMessage);

        log.info("{} completed: {}", getTranslationType(), summaryMessage);
        return result;
    }

    /**
     * Throws JobCancelledException if cancellation was requested.
     */
    protected void checkCancellation() {
        if (isCancelled()) {
            throw new JobCancelledException("Job " + jobId + " was cancelled");
        }
    }

    /**
     * Generates a summary message for the translation results.
     * Default implementation provides basic information.
     */
    protected String generateSummaryMessage(T result) {
        return String.format("Translation completed: %s",
                getTranslationType().replace("_", " ").toLowerCase(Locale.ROOT));
    }
}
