package pretium.reporting.config;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the report job queue API.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Report Job Queue API",
                version = "1.0.0",
                description = """
                        Asynchronous job queue for report generation.

                        ## Flow
                        - `POST /api/jobs` queues a job and wakes the worker
                        - `POST /api/jobs/trigger` wakes the worker without queueing anything
                        - `POST /api/jobs/process` drains the queue (worker entry point)
                        - `GET /api/jobs/{id}` returns the job state for polling
                        """,
                contact = @Contact(
                        name = "Pretium Engineering")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Jobs",
                description = "Job queue operations")})
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
