package pretium.reporting.integration.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.SpecificationMatchType;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the project knowledge search endpoint, which ranks uploaded specification chunks by embedding similarity.
 *
 * <p>
 * <b>Request:</b> {@code POST {report.knowledge.search-url}} with {@code {"projectId", "query", "limit"}}.
 * <b>Response:</b> {@code {"results": [{"content", "similarity", "chunkIndex", "knowledgeId", "fileName"}], ...}}.
 *
 * <p>
 * Lookups are best effort: when the URL is unset, the call fails, or the endpoint answers non-2xx, the client logs a
 * warning and returns an empty list so report drafting continues without citations.
 */
@ApplicationScoped
public class SpecificationSearchClient {

    private static final Logger LOG = Logger.getLogger(SpecificationSearchClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @ConfigProperty(
            name = "report.knowledge.search-url")
    Optional<String> searchUrl;

    @ConfigProperty(
            name = "report.knowledge.timeout",
            defaultValue = "PT15S")
    Duration timeout;

    @Inject
    public SpecificationSearchClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Searches a project's specifications.
     *
     * @param projectId
     *            project whose documents are searched; no lookup is made when null or blank
     * @param query
     *            free text, usually a photo description
     * @param limit
     *            maximum number of chunks
     * @return matches ordered by the endpoint, empty on any failure
     */
    public List<SpecificationMatchType> search(String projectId, String query, int limit) {
        Optional<String> url = searchUrl.map(String::trim).filter(value -> !value.isEmpty());
        if (url.isEmpty()) {
            LOG.debug("Specification search URL not configured, skipping lookup");
            return List.of();
        }
        if (projectId == null || projectId.isBlank() || query == null || query.isBlank()) {
            return List.of();
        }

        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("projectId", projectId);
            body.put("query", query);
            body.put("limit", limit);

            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url.get()))
                    .timeout(timeout != null ? timeout : Duration.ofSeconds(15))
                    .header("Content-Type", "application/json").header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body))).build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOG.warnf("Specification search for project %s returned status %d", projectId,
                        response.statusCode());
                return List.of();
            }

            JsonNode results = objectMapper.readTree(response.body()).path("results");
            if (!results.isArray()) {
                return List.of();
            }
            List<SpecificationMatchType> matches = objectMapper.convertValue(results,
                    new TypeReference<List<SpecificationMatchType>>() {
                    });
            LOG.debugf("Specification search for project %s returned %d matches", projectId, matches.size());
            return matches;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Specification search for project %s interrupted", projectId);
            return List.of();
        } catch (Exception e) {
            LOG.warnf(e, "Specification search failed for project %s", projectId);
            return List.of();
        }
    }
}
