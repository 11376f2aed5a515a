package ticketsync.server.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting a grooming failure.
 * POST /internal/v1/grooming/{id}/fail
 */
public record GroomingFailRequest(
        @JsonProperty("error") String error) {

    public void validate() {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }

    public static GroomingFailRequest of(String error) {
        return new GroomingFailRequest(error);
    }
}
