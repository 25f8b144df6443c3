package pretium.reporting.api.rest;

import jakarta.ws.rs.core.Response;

/**
 * Permissive CORS headers for the job endpoints, which are called from browsers and from other hosts' functions.
 */
final class CorsSupport {

    static final String ALLOW_ORIGIN = "*";
    static final String ALLOW_HEADERS = "authorization, x-client-info, apikey, content-type";
    static final String ALLOW_METHODS = "GET, POST, OPTIONS";

    private CorsSupport() {
    }

    static Response.ResponseBuilder withCors(Response.ResponseBuilder builder) {
        return builder.header("Access-Control-Allow-Origin", ALLOW_ORIGIN)
                .header("Access-Control-Allow-Headers", ALLOW_HEADERS)
                .header("Access-Control-Allow-Methods", ALLOW_METHODS);
    }

    /**
     * Preflight answer: 200 with body {@code ok}.
     */
    static Response preflight() {
        return withCors(Response.ok("ok", "text/plain")).build();
    }
}
