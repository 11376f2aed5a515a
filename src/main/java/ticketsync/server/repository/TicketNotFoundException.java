package ticketsync.server.repository;

/**
 * No ticket exists for the requested id.
 */
public class TicketNotFoundException extends RuntimeException {

    private final String ticketId;

    public TicketNotFoundException(String ticketId) {
        super("Ticket " + ticketId + " not found");
        this.ticketId = ticketId;
    }

    public String ticketId() {
        return ticketId;
    }
}
