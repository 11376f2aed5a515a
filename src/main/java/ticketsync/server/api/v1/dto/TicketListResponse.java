package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.model.Ticket;

import java.util.List;

/**
 * GET /api/v1/tickets
 */
public record TicketListResponse(
        @JsonProperty("tickets") List<TicketResponse> tickets,
        @JsonProperty("count") int count) {

    public static TicketListResponse from(List<Ticket> tickets) {
        List<TicketResponse> items = tickets.stream().map(TicketResponse::from).toList();
        return new TicketListResponse(items, items.size());
    }
}
