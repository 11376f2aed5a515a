package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

/**
 * Request DTO for creating a ticket.
 * POST /api/v1/tickets
 */
public record CreateTicketRequest(
        @JsonProperty("title") String title,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("project") String project,
        @JsonProperty("assignee") String assignee,
        @JsonProperty("estimate") Double estimate,
        @JsonProperty("body") String body) {

    /** Validate the request */
    public void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (status != null) {
            TicketStatus.fromWire(status);
        }
        if (priority != null) {
            TicketPriority.fromWire(priority);
        }
    }

    public CreateTicketInput toInput() {
        return new CreateTicketInput(
                title,
                status != null ? TicketStatus.fromWire(status) : null,
                priority != null ? TicketPriority.fromWire(priority) : null,
                project,
                assignee,
                estimate,
                body);
    }

    public static CreateTicketRequest of(String title) {
        return new CreateTicketRequest(title, null, null, null, null, null, null);
    }
}
