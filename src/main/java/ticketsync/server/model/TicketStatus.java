package ticketsync.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ticket lifecycle status.
 */
public enum TicketStatus {
    /** Newly filed, not yet planned */
    BACKLOG("backlog"),
    /** Planned for work */
    TODO("todo"),
    /** Being worked on */
    IN_PROGRESS("in-progress"),
    /** Finished */
    DONE("done");

    /** Status assigned to tickets created without an explicit status */
    public static final TicketStatus INITIAL = BACKLOG;

    private final String wireName;

    TicketStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TicketStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (TicketStatus s : values()) {
            if (s.wireName.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid ticket status: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
