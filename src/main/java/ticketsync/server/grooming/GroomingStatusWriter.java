package ticketsync.server.grooming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.repository.TicketRepository;

/**
 * Writes grooming status into a ticket by merging a partial status over the stored one.
 */
class GroomingStatusWriter {

    private static final Logger log = LoggerFactory.getLogger(GroomingStatusWriter.class);

    private final TicketRepository repository;

    GroomingStatusWriter(TicketRepository repository) {
        this.repository = repository;
    }

    /**
     * Merge {@code partial} into the ticket's grooming status and persist it.
     *
     * @throws ticketsync.server.repository.TicketNotFoundException if the ticket is gone
     */
    Ticket apply(String ticketId, GroomingStatus partial) {
        Ticket current = repository.get(ticketId);
        GroomingStatus merged = partial.mergeInto(current.grooming());
        Ticket updated = repository.update(ticketId, TicketPatch.grooming(merged));
        log.info("Updated {} grooming status to {}", ticketId, merged.status());
        return updated;
    }

    /**
     * Like {@link #apply} but logs failures instead of throwing.
     *
     * @return true if the status was written
     */
    boolean applyQuietly(String ticketId, GroomingStatus partial) {
        try {
            apply(ticketId, partial);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to update grooming status for {}: {}", ticketId, e.getMessage());
            return false;
        }
    }
}
