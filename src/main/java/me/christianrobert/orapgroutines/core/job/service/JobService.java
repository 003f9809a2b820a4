package me.christianrobert.orapgroutines.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.orapgroutines.core.job.Job;
import me.christianrobert.orapgroutines.core.job.exception.JobCancelledException;
import me.christianrobert.orapgroutines.core.job.model.JobProgress;
import me.christianrobert.orapgroutines.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs submitted jobs in the background and keeps their status, progress and result
 * for polling through {@code /api/jobs}.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    /**
     * Shared thread pool for all job executions.
     */
    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        log.info("Initializing shared ExecutorService for job execution");
        executorService = Executors.newCachedThreadPool();
    }

    /**
     * Shuts down the thread pool on application shutdown.
     * Waits up to 30 seconds for running jobs to complete.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ExecutorService");
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        try {
            executorService.shutdown();
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in 30s, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down executor service", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status;
        private volatile JobProgress progress;
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Exception error;
        private volatile CompletableFuture<T> future;

        public JobExecution(Job<T> job) {
            this.job = job;
            this.status = JobStatus.PENDING;
            this.progress = new JobProgress();
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public void setStatus(JobStatus status) { this.status = status; }
        public JobProgress getProgress() { return progress; }
        public void setProgress(JobProgress progress) { this.progress = progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
        public T getResult() { return result; }
        public void setResult(T result) { this.result = result; }
        public Exception getError() { return error; }
        public void setError(Exception error) { this.error = error; }
        public CompletableFuture<T> getFuture() { return future; }
        public void setFuture(CompletableFuture<T> future) { this.future = future; }
    }

    public <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();

        log.info("Submitting job: {} ({})", jobId, job.getJobType());

        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            execution.setStatus(JobStatus.RUNNING);
            execution.setStartTime(LocalDateTime.now());

            log.info("Starting job execution: {}", jobId);

            try {
                T result = job.execute(progress -> {
                    execution.setProgress(progress);
                    log.debug("Job {} progress: {}%", jobId, progress.getPercentage());
                }).get();

                execution.setResult(result);
                execution.setStatus(JobStatus.COMPLETED);
                execution.setEndTime(LocalDateTime.now());

                log.info("Job completed successfully: {}", jobId);
                return result;

            } catch (Exception e) {
                execution.setEndTime(LocalDateTime.now());
                if (isCancellation(e)) {
                    execution.setStatus(JobStatus.CANCELLED);
                    log.info("Job cancelled: {}", jobId);
                    return null;
                }

                execution.setError(e);
                execution.setStatus(JobStatus.FAILED);
                log.error("Job failed: " + jobId, e);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw new RuntimeException("Job execution failed: " + e.getMessage(), e);
            }
        }, executorService);

        execution.setFuture(future);
        return jobId;
    }

    private static boolean isCancellation(Exception e) {
        return e instanceof JobCancelledException
                || (e instanceof ExecutionException && e.getCause() instanceof JobCancelledException);
    }

    /**
     * Requests cancellation of a running job.
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancelJob(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution == null || execution.getStatus().isTerminal()) {
            return false;
        }
        execution.getJob().cancel();
        return true;
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            T result = (T) execution.getResult();
            return result;
        }
        return null;
    }

    public Exception getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.FAILED) {
            return execution.getError();
        }
        return null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status != null && status.isTerminal();
    }

    public void cleanupOldJobs(int maxAgeHours) {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(maxAgeHours);

        jobExecutions.entrySet().removeIf(entry -> {
            LocalDateTime endTime = entry.getValue().getEndTime();
            if (endTime != null && endTime.isBefore(cutoff)) {
                log.debug("Cleaning up old job: {}", entry.getKey());
                return true;
            }
            return false;
        });
    }
}
