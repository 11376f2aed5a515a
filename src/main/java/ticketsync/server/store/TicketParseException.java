package ticketsync.server.store;

/**
 * A ticket file exists but its content is malformed.
 */
public class TicketParseException extends RuntimeException {

    public TicketParseException(String message) {
        super(message);
    }

    public TicketParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
