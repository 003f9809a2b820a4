package me.christianrobert.orapgroutines.core.job;

import me.christianrobert.orapgroutines.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface Job<T> {

    String getJobId();

    String getJobType();

    String getDescription();

    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    /**
     * Requests cooperative cancellation; the job stops at its next checkpoint.
     */
    void cancel();

    boolean isCancelled();

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask));
        }
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}
