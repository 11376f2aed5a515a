package ticketsync.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted grooming metadata, stored under the {@code grooming} key of the ticket front matter.
 * Only {@code status} is required.
 *
 * <p>Updates are expressed as partial instances where {@code null} means "keep the current value";
 * see {@link #mergeInto(GroomingStatus)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroomingStatus(
        @JsonProperty("status") GroomingState status,
        @JsonProperty("triggeredAt") Instant triggeredAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("sessionKey") String sessionKey,
        @JsonProperty("attempts") Integer attempts,
        @JsonProperty("lastError") String lastError) {

    public static GroomingStatus of(GroomingState status) {
        return new GroomingStatus(status, null, null, null, null, null);
    }

    /**
     * Overlay the non-null fields of this (partial) status onto {@code current}.
     * A null {@code current} yields this status as-is.
     */
    public GroomingStatus mergeInto(GroomingStatus current) {
        if (current == null) {
            return this;
        }
        return new GroomingStatus(
                status != null ? status : current.status,
                triggeredAt != null ? triggeredAt : current.triggeredAt,
                completedAt != null ? completedAt : current.completedAt,
                sessionKey != null ? sessionKey : current.sessionKey,
                attempts != null ? attempts : current.attempts,
                lastError != null ? lastError : current.lastError);
    }

    /** Attempt counter, treating an absent value as zero */
    @JsonIgnore
    public int attemptCount() {
        return attempts != null ? attempts : 0;
    }

    @JsonIgnore
    public boolean isInFlight() {
        return status != null && status.isInFlight();
    }

    public GroomingStatus withTriggeredAt(Instant at) {
        return new GroomingStatus(status, at, completedAt, sessionKey, attempts, lastError);
    }

    public GroomingStatus withCompletedAt(Instant at) {
        return new GroomingStatus(status, triggeredAt, at, sessionKey, attempts, lastError);
    }

    public GroomingStatus withSessionKey(String key) {
        return new GroomingStatus(status, triggeredAt, completedAt, key, attempts, lastError);
    }

    public GroomingStatus withAttempts(int count) {
        return new GroomingStatus(status, triggeredAt, completedAt, sessionKey, count, lastError);
    }

    public GroomingStatus withLastError(String error) {
        return new GroomingStatus(status, triggeredAt, completedAt, sessionKey, attempts, error);
    }

    /** Validate a status read from disk or from a request */
    public void validate() {
        if (status == null) {
            throw new IllegalArgumentException("grooming.status is required");
        }
        if (attempts != null && attempts < 0) {
            throw new IllegalArgumentException("grooming.attempts must not be negative");
        }
    }
}
