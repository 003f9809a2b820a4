package me.christianrobert.orapgroutines.routine.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageSource;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import me.christianrobert.orapgroutines.core.job.service.JobService;
import me.christianrobert.orapgroutines.routine.job.PackageTranslationJob;
import me.christianrobert.orapgroutines.transformer.context.TranslationContext;
import me.christianrobert.orapgroutines.transformer.service.PackageTranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * REST resource for translating package routines.
 *
 * A single package is translated synchronously; a batch runs as a job whose status and
 * result are polled through {@code /api/jobs/{jobId}}. Translation outcomes, failed
 * routines included, are returned with HTTP 200. Only malformed requests get 400.
 */
@ApplicationScoped
@Path("/api/routines")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoutineTranslationResource {

    private static final Logger log = LoggerFactory.getLogger(RoutineTranslationResource.class);

    @Inject
    PackageTranslationService translationService;

    @Inject
    JobService jobService;

    @Inject
    Instance<PackageTranslationJob> jobFactory;

    @POST
    @Path("/package")
    public Response translatePackage(PackageSource source) {
        String problem = validate(source);
        if (problem != null) {
            return badRequest(problem);
        }

        log.info("Translating package {} via REST API", source.getDisplayName());

        TranslationContext context;
        try {
            context = translationService.createContext();
        } catch (IllegalArgumentException e) {
            return badRequest("Invalid configuration: " + e.getMessage());
        }

        PackageTranslationReport report = translationService.translatePackage(source, context);
        return Response.ok(report).build();
    }

    @POST
    @Path("/run")
    public Response startTranslationRun(List<PackageSource> packages) {
        if (packages == null || packages.isEmpty()) {
            return badRequest("Request body must be a non-empty list of packages");
        }
        for (int i = 0; i < packages.size(); i++) {
            String problem = validate(packages.get(i));
            if (problem != null) {
                return badRequest("Package #" + (i + 1) + ": " + problem);
            }
        }

        log.info("Starting translation run for {} packages via REST API", packages.size());

        try {
            PackageTranslationJob job = jobFactory.get();
            job.setPackages(packages);
            String jobId = jobService.submitJob(job);

            Map<String, Object> result = Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", "Translation run started for " + packages.size() + " packages"
            );

            log.info("Translation run started with ID: {}", jobId);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Failed to start translation run", e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Failed to start translation run: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    private static String validate(PackageSource source) {
        if (source == null) {
            return "Request body is required";
        }
        if (source.getBodySql() == null || source.getBodySql().isBlank()) {
            return "Package body source (bodySql) is required";
        }
        return null;
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("status", "error", "message", message))
                .build();
    }
}
