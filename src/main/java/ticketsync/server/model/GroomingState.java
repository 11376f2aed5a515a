package ticketsync.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an asynchronous grooming job for one ticket.
 */
public enum GroomingState {
    /** Invocation accepted locally, remote call not yet resolved */
    PENDING("pending"),
    /** Remote agent acknowledged, session is live */
    IN_PROGRESS("in-progress"),
    /** Grooming finished (reported or inferred from content) */
    COMPLETE("complete"),
    /** Invocation exhausted its retries or the session timed out */
    FAILED("failed"),
    /** Groomed by hand */
    MANUAL("manual");

    private final String wireName;

    GroomingState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static GroomingState fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (GroomingState s : values()) {
            if (s.wireName.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid grooming status: " + value);
    }

    /** Pending or in-progress: a job is believed to be running somewhere */
    public boolean isInFlight() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == MANUAL;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
