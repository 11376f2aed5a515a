package ticketsync.server.repository;

import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPatch;

import java.util.List;

/**
 * Repository interface for ticket persistence.
 * The store is the ground truth for the rest of the system; it performs no locking of its own,
 * so read-modify-write sequences by callers are best-effort.
 */
public interface TicketRepository {

    /**
     * List tickets. Unparseable entries are skipped and logged rather than failing the call.
     *
     * @param query filters and sort order
     * @return matching tickets in the requested order
     */
    List<Ticket> list(TicketQuery query);

    /**
     * Find a ticket by id.
     *
     * @param id the ticket id
     * @return the ticket
     * @throws TicketNotFoundException if no ticket exists with that id
     */
    Ticket get(String id);

    /**
     * Create a ticket with the next free id. Creation and modification timestamps are identical.
     *
     * @param input ticket fields
     * @return the stored ticket
     */
    Ticket create(CreateTicketInput input);

    /**
     * Merge a patch over an existing ticket. The id is preserved and the modification
     * timestamp always moves forward, even when no other field changes.
     *
     * @param id    the ticket id
     * @param patch fields to change
     * @return the stored ticket
     * @throws TicketNotFoundException if no ticket exists with that id
     */
    Ticket update(String id, TicketPatch patch);

    /**
     * Delete a ticket.
     *
     * @param id the ticket id
     * @throws TicketNotFoundException if no ticket exists with that id
     */
    void delete(String id);

    /**
     * Count ticket entries (parseable or not).
     */
    int count();
}
