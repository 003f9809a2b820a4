package me.christianrobert.orapgroutines.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.transformer.emit.RoutineNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        Object namingMode = config.get(ConfigService.NAMING_MODE);
        if (namingMode != null && !RoutineNaming.isKnownMode(namingMode.toString())) {
            return badRequest("Unknown naming mode: " + namingMode);
        }

        configService.updateConfiguration(config);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration saved successfully");
        return Response.ok(response).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value = body.get("value");
        if (ConfigService.NAMING_MODE.equals(key) && (value == null || !RoutineNaming.isKnownMode(value.toString()))) {
            return badRequest("Unknown naming mode: " + value);
        }
        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("key", key);
        response.put("value", value);
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success",
                "message", "Configuration reset to defaults successfully")).build();
    }

    private Response badRequest(String message) {
        log.warn("Rejected configuration change: {}", message);
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("status", "error", "message", message))
                .build();
    }
}
