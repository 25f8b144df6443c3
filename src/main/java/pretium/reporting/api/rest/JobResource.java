package pretium.reporting.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.EnqueueJobRequestType;
import pretium.reporting.api.types.EnqueueJobResponseType;
import pretium.reporting.api.types.JobRecordType;
import pretium.reporting.data.models.Job;
import pretium.reporting.exceptions.StoreUnavailableException;
import pretium.reporting.exceptions.TriggerConfigurationException;
import pretium.reporting.exceptions.ValidationException;
import pretium.reporting.services.QueueClient;
import pretium.reporting.services.TriggerGateway;

import java.util.Optional;
import java.util.UUID;

/**
 * Enqueue and status endpoints for jobs.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/jobs} - validate, persist as queued, fire the worker trigger, return the job id (202)</li>
 * <li>{@code GET /api/jobs/{id}} - current job state for polling</li>
 * </ul>
 *
 * <p>
 * The enqueue response does not depend on the trigger: a trigger that cannot be sent is logged and the job waits for
 * the next drain.
 */
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Jobs",
        description = "Job queue operations")
public class JobResource {

    private static final Logger LOG = Logger.getLogger(JobResource.class);

    @Inject
    QueueClient queueClient;

    @Inject
    TriggerGateway triggerGateway;

    @POST
    @Operation(
            summary = "Enqueue job",
            description = "Queues a job and wakes the worker; returns before the job runs")
    public Response enqueue(@Valid EnqueueJobRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        UUID jobId;
        try {
            jobId = queueClient.enqueue(request.jobType(), request.payload());
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "Failed to enqueue job of type %s", request.jobType());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Job store unavailable")).build();
        }

        try {
            triggerGateway.fire();
        } catch (TriggerConfigurationException e) {
            LOG.warnf("Job %s queued but worker not triggered: %s", jobId, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job %s queued but worker trigger failed", jobId);
        }

        return Response.accepted(new EnqueueJobResponseType(jobId)).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get job",
            description = "Returns job status, result or error")
    public Response getJob(@PathParam("id") UUID id) {
        Optional<Job> job;
        try {
            job = queueClient.getJob(id);
        } catch (StoreUnavailableException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Job store unavailable")).build();
        }
        if (job.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse("Job not found: " + id))
                    .build();
        }
        return Response.ok(JobRecordType.fromEntity(job.get())).build();
    }

    public record ErrorResponse(String error) {
    }
}
