package pretium.reporting.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of {@code POST /api/jobs/trigger}. Exactly one of {@code message} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponseType(boolean success, String message, String error) {

    public static TriggerResponseType triggered() {
        return new TriggerResponseType(true, "Job processor triggered successfully", null);
    }

    public static TriggerResponseType failed(String error) {
        return new TriggerResponseType(false, null, error);
    }
}
