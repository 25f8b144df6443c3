package pretium.reporting.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.DrainResultType;
import pretium.reporting.observability.LoggingConfig;
import pretium.reporting.services.DrainResult;
import pretium.reporting.services.JobDrainService;

/**
 * Worker entry point: drains the queue in the request thread. This is the usual target of
 * {@code jobs.trigger.worker-url}.
 */
@Path("/api/jobs/process")
@Tag(
        name = "Jobs",
        description = "Job queue operations")
public class ProcessJobsResource {

    private static final Logger LOG = Logger.getLogger(ProcessJobsResource.class);

    @Inject
    JobDrainService drainService;

    @OPTIONS
    public Response preflight() {
        return CorsSupport.preflight();
    }

    @POST
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Process queued jobs",
            description = "Processes jobs until the queue is empty and reports failures")
    public Response process() {
        LoggingConfig.setRequestOrigin("/api/jobs/process");
        try {
            DrainResult result = drainService.drainAll();
            return CorsSupport.withCors(Response.ok(DrainResultType.fromResult(result))).build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Queue drain failed");
            return CorsSupport.withCors(Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse(false, e.getMessage()))).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    public record ErrorResponse(boolean success, String error) {
    }
}
