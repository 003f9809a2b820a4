package me.christianrobert.orapgroutines.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.orapgroutines.core.job.model.JobProgress;
import me.christianrobert.orapgroutines.core.job.model.JobStatus;
import me.christianrobert.orapgroutines.core.job.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Generic REST resource for job status, result retrieval and cancellation.
 * Jobs are started by the domain resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Getting job status for: {}", jobId);

        JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return jobNotFound(jobId);
        }

        JobStatus status = execution.getStatus();
        JobProgress progress = execution.getProgress();

        Map<String, Object> result = new HashMap<>();
        result.put("jobId", jobId);
        result.put("jobType", execution.getJob().getJobType());
        result.put("status", status.name());
        result.put("isComplete", status.isTerminal());

        if (progress != null) {
            result.put("progress", Map.of(
                    "percentage", progress.getPercentage(),
                    "currentTask", progress.getCurrentTask(),
                    "details", progress.getDetails(),
                    "lastUpdated", progress.getLastUpdated().toString()
            ));
        }

        if (status == JobStatus.FAILED && execution.getError() != null) {
            result.put("error", execution.getError().getMessage());
        }
        if (execution.getStartTime() != null) {
            result.put("startTime", execution.getStartTime().toString());
        }
        if (execution.getEndTime() != null) {
            result.put("endTime", execution.getEndTime().toString());
        }

        return Response.ok(result).build();
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Getting job result for: {}", jobId);

        JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return jobNotFound(jobId);
        }

        if (execution.getStatus() != JobStatus.COMPLETED) {
            Map<String, Object> pending = new HashMap<>();
            pending.put("jobId", jobId);
            pending.put("status", execution.getStatus().name());
            pending.put("message", "Job has no result (status " + execution.getStatus() + ")");
            return Response.status(Response.Status.CONFLICT).entity(pending).build();
        }

        Map<String, Object> result = new HashMap<>();
        result.put("jobId", jobId);
        result.put("status", "success");
        result.put("result", execution.getResult());
        return Response.ok(result).build();
    }

    @POST
    @Path("/{jobId}/cancel")
    public Response cancelJob(@PathParam("jobId") String jobId) {
        log.info("Cancelling job: {}", jobId);

        if (jobService.getJobExecution(jobId) == null) {
            return jobNotFound(jobId);
        }

        boolean requested = jobService.cancelJob(jobId);
        return Response.ok(Map.of(
                "jobId", jobId,
                "cancellationRequested", requested
        )).build();
    }

    private static Response jobNotFound(String jobId) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("status", "error", "message", "Job not found: " + jobId))
                .build();
    }
}
