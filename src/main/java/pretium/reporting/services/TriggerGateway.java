package pretium.reporting.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import pretium.reporting.exceptions.TriggerConfigurationException;
import pretium.reporting.observability.JobMetrics;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Wakes the worker that drains the queue without waiting for it.
 *
 * <p>
 * {@link #fire()} sends one POST to {@code jobs.trigger.worker-url} and returns as soon as the request is handed to the
 * HTTP client. Delivery failures (connection refused, timeouts, non-2xx) are logged and counted, never thrown: the
 * jobs stay queued and the next trigger picks them up. Only a missing or malformed worker URL is reported to the caller.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code jobs.trigger.worker-url} - drain endpoint, required</li>
 * <li>{@code jobs.trigger.auth-token} - sent as {@code Authorization: Bearer} and {@code apikey}, optional</li>
 * <li>{@code jobs.trigger.timeout} - request timeout (default 10s)</li>
 * </ul>
 */
@ApplicationScoped
public class TriggerGateway {

    private static final Logger LOG = Logger.getLogger(TriggerGateway.class);

    static final String WORKER_URL_PROPERTY = "jobs.trigger.worker-url";

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @ConfigProperty(
            name = WORKER_URL_PROPERTY)
    Optional<String> workerUrl;

    @ConfigProperty(
            name = "jobs.trigger.auth-token")
    Optional<String> authToken;

    @ConfigProperty(
            name = "jobs.trigger.timeout",
            defaultValue = "PT10S")
    Duration timeout;

    @Inject
    JobMetrics metrics;

    /**
     * Sends the wake-up request.
     *
     * @return future completing with {@code true} once the worker answered 2xx, {@code false} on any delivery
     *         failure; it never completes exceptionally and callers are free to ignore it
     * @throws TriggerConfigurationException
     *             if no worker URL is configured or it is not an absolute http(s) URL
     */
    public CompletableFuture<Boolean> fire() {
        String url = workerUrl.map(String::trim).filter(value -> !value.isEmpty()).orElse(null);
        if (url == null) {
            record("unconfigured");
            throw new TriggerConfigurationException("Missing " + WORKER_URL_PROPERTY + " configuration");
        }

        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(url));
        } catch (IllegalArgumentException e) {
            record("unconfigured");
            throw new TriggerConfigurationException(
                    "Invalid " + WORKER_URL_PROPERTY + " configuration: " + e.getMessage(), e);
        }
        request.timeout(timeout != null ? timeout : Duration.ofSeconds(10)).header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"));
        authToken.map(String::trim).filter(token -> !token.isEmpty()).ifPresent(
                token -> request.header("Authorization", "Bearer " + token).header("apikey", token));

        LOG.debugf("Triggering job processor at %s", url);
        record("sent");
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        LOG.warnf(error, "Job processor trigger to %s was not delivered", url);
                        record("undelivered");
                        return false;
                    }
                    if (response.statusCode() / 100 != 2) {
                        LOG.errorf("Job processor at %s answered trigger with status %d", url, response.statusCode());
                        record("undelivered");
                        return false;
                    }
                    record("delivered");
                    return true;
                });
    }

    private void record(String result) {
        if (metrics != null) {
            metrics.recordTrigger(result);
        }
    }
}
