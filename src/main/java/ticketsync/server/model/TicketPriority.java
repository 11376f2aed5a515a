package ticketsync.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ticket priority. Sorting uses {@link #rank()}, so ascending order is high, medium, low.
 */
public enum TicketPriority {
    LOW("low", 3),
    MEDIUM("medium", 2),
    HIGH("high", 1);

    private final String wireName;
    private final int rank;

    TicketPriority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    @JsonCreator
    public static TicketPriority fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (TicketPriority p : values()) {
            if (p.wireName.equals(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Invalid ticket priority: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
