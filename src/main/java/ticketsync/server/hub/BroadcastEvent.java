package ticketsync.server.hub;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.api.v1.dto.TicketResponse;
import ticketsync.server.model.Ticket;

import java.util.List;

/**
 * Outbound broadcast message: {@code {"type": ..., "payload": ...}}.
 */
public record BroadcastEvent(
        @JsonProperty("type") String type,
        @JsonProperty("payload") Object payload) {

    public static final String TICKETS_INIT = "tickets:init";
    public static final String TICKET_CREATED = "ticket:created";
    public static final String TICKET_UPDATED = "ticket:updated";
    public static final String TICKET_DELETED = "ticket:deleted";
    public static final String ERROR = "error";

    public static BroadcastEvent ticketsInit(List<Ticket> tickets) {
        return new BroadcastEvent(TICKETS_INIT, tickets.stream().map(TicketResponse::from).toList());
    }

    public static BroadcastEvent ticketCreated(Ticket ticket) {
        return new BroadcastEvent(TICKET_CREATED, TicketResponse.from(ticket));
    }

    public static BroadcastEvent ticketUpdated(Ticket ticket) {
        return new BroadcastEvent(TICKET_UPDATED, TicketResponse.from(ticket));
    }

    public static BroadcastEvent ticketDeleted(String id) {
        return new BroadcastEvent(TICKET_DELETED, new Deleted(id));
    }

    public static BroadcastEvent error(String message) {
        return new BroadcastEvent(ERROR, new Failure(message));
    }

    /**
     * Ticket this event is about, or null for list/error events.
     */
    @JsonIgnore
    public String ticketId() {
        if (payload instanceof TicketResponse ticket) {
            return ticket.id();
        }
        if (payload instanceof Deleted deleted) {
            return deleted.id();
        }
        return null;
    }

    public record Deleted(@JsonProperty("id") String id) {
    }

    public record Failure(@JsonProperty("message") String message) {
    }
}
