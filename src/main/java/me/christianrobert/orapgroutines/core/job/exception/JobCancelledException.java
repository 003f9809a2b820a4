package me.christianrobert.orapgroutines.core.job.exception;

/**
 * Exception thrown when a job is cancelled during execution.
 *
 * This exception signals cooperative cancellation: the job saw the cancellation flag
 * at a checkpoint and exits early. It is not an error condition.
 *
 * Usage:
 * <pre>
 * protected void checkCancellation() {
 *     if (isCancelled()) {
 *         throw new JobCancelledException("Job was cancelled");
 *     }
 * }
 * </pre>
 *
 * The JobService catches this exception and marks the job as CANCELLED
 * rather than FAILED.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException() {
        super("Job was cancelled");
    }

    public JobCancelledException(String message) {
        super(message);
    }

    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
