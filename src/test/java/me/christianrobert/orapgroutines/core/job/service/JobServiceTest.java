package me.christianrobert.orapgroutines.core.job.service;

import me.christianrobert.orapgroutines.core.job.AbstractTranslationJob;
import me.christianrobert.orapgroutines.core.job.model.JobProgress;
import me.christianrobert.orapgroutines.core.job.model.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService();
        jobService.init();
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    /**
     * Job that optionally waits for a release signal, then checks for cancellation.
     */
    private static class TestJob extends AbstractTranslationJob<String> {

        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release;
        private final RuntimeException failure;

        TestJob(CountDownLatch release, RuntimeException failure) {
            this.release = release;
            this.failure = failure;
        }

        @Override
        protected String getTranslationType() {
            return "TEST_TRANSLATION";
        }

        @Override
        protected String performTranslation(Consumer<JobProgress> progressCallback) throws Exception {
            started.countDown();
            updateProgress(progressCallback, 50, "Working");
            if (release != null) {
                release.await(5, TimeUnit.SECONDS);
            }
            checkCancellation();
            if (failure != null) {
                throw failure;
            }
            return "done";
        }
    }

    private static Object await(JobService service, String jobId) throws Exception {
        return service.getJobExecution(jobId).getFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void submitJob_completesWithResult() throws Exception {
        TestJob job = new TestJob(null, null);

        String jobId = jobService.submitJob(job);
        assertEquals(job.getJobId(), jobId);
        assertTrue(jobId.startsWith("test-translation-"), jobId);

        assertEquals("done", await(jobService, jobId));
        assertAll(
                () -> assertEquals(JobStatus.COMPLETED, jobService.getJobStatus(jobId)),
                () -> assertTrue(jobService.isJobComplete(jobId)),
                () -> assertEquals("done", jobService.<String>getJobResult(jobId)),
                () -> assertEquals(100, jobService.getJobProgress(jobId).getPercentage()),
                () -> assertNull(jobService.getJobError(jobId)),
                () -> assertNotNull(jobService.getJobExecution(jobId).getEndTime())
        );
    }

    @Test
    void submitJob_failureIsRecorded() {
        TestJob job = new TestJob(null, new IllegalStateException("broken input"));

        String jobId = jobService.submitJob(job);

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(jobService, jobId));
        assertTrue(e.getCause().getMessage().contains("broken input"), e.getCause().getMessage());
        assertEquals(JobStatus.FAILED, jobService.getJobStatus(jobId));
        assertNotNull(jobService.getJobError(jobId));
        assertNull(jobService.getJobResult(jobId));
    }

    @Test
    void cancelJob_stopsAtNextCheckpoint() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        TestJob job = new TestJob(release, null);

        String jobId = jobService.submitJob(job);
        assertTrue(job.started.await(5, TimeUnit.SECONDS));

        assertTrue(jobService.cancelJob(jobId));
        release.countDown();

        assertNull(await(jobService, jobId));
        assertEquals(JobStatus.CANCELLED, jobService.getJobStatus(jobId));
        assertTrue(job.isCancelled());
        assertFalse(jobService.cancelJob(jobId), "A finished job cannot be cancelled");
    }

    @Test
    void unknownJob() {
        assertNull(jobService.getJobStatus("nope"));
        assertNull(jobService.getJobProgress("nope"));
        assertFalse(jobService.isJobComplete("nope"));
        assertFalse(jobService.cancelJob("nope"));
    }

    @Test
    void cleanupOldJobs_keepsRecentJobs() throws Exception {
        String jobId = jobService.submitJob(new TestJob(null, null));
        await(jobService, jobId);

        jobService.cleanupOldJobs(1);

        assertNotNull(jobService.getJobExecution(jobId));
    }
}
