package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

/**
 * Request DTO for a partial ticket update. Absent fields are left unchanged.
 * PATCH /api/v1/tickets/{id}
 */
public record UpdateTicketRequest(
        @JsonProperty("title") String title,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("project") String project,
        @JsonProperty("assignee") String assignee,
        @JsonProperty("estimate") Double estimate,
        @JsonProperty("body") String body,
        @JsonProperty("grooming") GroomingStatus grooming) {

    public TicketPatch toPatch() {
        return new TicketPatch(
                title,
                status != null ? TicketStatus.fromWire(status) : null,
                priority != null ? TicketPriority.fromWire(priority) : null,
                project,
                assignee,
                estimate,
                body,
                grooming);
    }
}
