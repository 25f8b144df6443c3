package pretium.reporting.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.TriggerResponseType;
import pretium.reporting.exceptions.TriggerConfigurationException;
import pretium.reporting.services.TriggerGateway;

/**
 * Fire-and-forget wake-up for the queue worker.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code OPTIONS /api/jobs/trigger} - CORS preflight, no side effect</li>
 * <li>{@code POST /api/jobs/trigger} - sends one request to the worker and returns without waiting for it</li>
 * </ul>
 *
 * <p>
 * A 200 only means the wake-up was sent. Whether the worker was reached is logged by {@link TriggerGateway}.
 */
@Path("/api/jobs/trigger")
@Tag(
        name = "Jobs",
        description = "Job queue operations")
public class TriggerResource {

    private static final Logger LOG = Logger.getLogger(TriggerResource.class);

    @Inject
    TriggerGateway triggerGateway;

    @OPTIONS
    public Response preflight() {
        return CorsSupport.preflight();
    }

    @POST
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Trigger job processor",
            description = "Asynchronously wakes the worker that drains the job queue")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Wake-up sent",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = TriggerResponseType.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "Worker URL not configured")})
    public Response trigger() {
        try {
            triggerGateway.fire();
            return CorsSupport.withCors(Response.ok(TriggerResponseType.triggered())).build();
        } catch (TriggerConfigurationException e) {
            LOG.errorf("Cannot trigger job processor: %s", e.getMessage());
            return CorsSupport.withCors(Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(TriggerResponseType.failed(e.getMessage()))).build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to trigger job processor");
            return CorsSupport.withCors(Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(TriggerResponseType.failed(e.getMessage() != null ? e.getMessage() : "Trigger failed")))
                    .build();
        }
    }
}
