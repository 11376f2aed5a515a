package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

import java.time.Instant;

/**
 * Wire form of a ticket, used by the REST API and the broadcast protocol.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketResponse(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("status") TicketStatus status,
        @JsonProperty("priority") TicketPriority priority,
        @JsonProperty("project") String project,
        @JsonProperty("assignee") String assignee,
        @JsonProperty("estimate") Double estimate,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("body") String body,
        @JsonProperty("grooming") GroomingStatus grooming) {

    /** Create response from domain model */
    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.id(),
                ticket.title(),
                ticket.status(),
                ticket.priority(),
                ticket.project(),
                ticket.assignee(),
                ticket.estimate(),
                ticket.createdAt(),
                ticket.updatedAt(),
                ticket.body(),
                ticket.grooming());
    }
}
