package ticketsync.server.store;

import ticketsync.server.model.Ticket;

/**
 * Byte-level format of a ticket file.
 */
public interface TicketCodec {

    /**
     * Parse file content.
     *
     * @param source  file name or path, used in error messages
     * @param content raw file bytes
     * @return the ticket
     * @throws TicketParseException if the content is not a valid ticket
     */
    Ticket parse(String source, byte[] content);

    /**
     * Serialize a ticket to file content.
     */
    byte[] serialize(Ticket ticket);
}
