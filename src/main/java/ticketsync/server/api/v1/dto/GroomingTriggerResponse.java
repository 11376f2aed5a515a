package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.grooming.GroomingOutcome;

/**
 * Response DTO for a manual grooming trigger.
 * POST /api/v1/tickets/{id}/groom
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroomingTriggerResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("sessionKey") String sessionKey,
        @JsonProperty("error") String error) {

    public static GroomingTriggerResponse from(GroomingOutcome outcome) {
        return new GroomingTriggerResponse(outcome.success(), outcome.sessionKey(), outcome.error());
    }
}
