package ticketsync.server.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketId;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.repository.TicketQuery;
import ticketsync.server.repository.TicketRepository;

import java.util.List;

/**
 * Service layer for ticket operations.
 * Validates input before it reaches the repository.
 */
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private final TicketRepository ticketRepository;

    public TicketService(TicketRepository ticketRepository) {
        this.ticketRepository = ticketRepository;
    }

    public List<Ticket> list(TicketQuery query) {
        return ticketRepository.list(query != null ? query : TicketQuery.all());
    }

    /**
     * @throws ticketsync.server.repository.TicketNotFoundException if no such ticket
     */
    public Ticket get(String ticketId) {
        requireValidId(ticketId);
        return ticketRepository.get(ticketId);
    }

    public Ticket create(CreateTicketInput input) {
        if (input == null) {
            throw new IllegalArgumentException("ticket input is required");
        }
        input.validate();

        Ticket ticket = ticketRepository.create(input);
        log.info("Created ticket {} ({})", ticket.id(), ticket.title());
        return ticket;
    }

    public Ticket update(String ticketId, TicketPatch patch) {
        requireValidId(ticketId);
        if (patch == null) {
            throw new IllegalArgumentException("patch is required");
        }
        patch.validate();

        Ticket ticket = ticketRepository.update(ticketId, patch);
        log.info("Updated ticket {}", ticketId);
        return ticket;
    }

    public void delete(String ticketId) {
        requireValidId(ticketId);
        ticketRepository.delete(ticketId);
        log.info("Deleted ticket {}", ticketId);
    }

    public int count() {
        return ticketRepository.count();
    }

    private static void requireValidId(String ticketId) {
        if (ticketId == null || ticketId.isBlank()) {
            throw new IllegalArgumentException("ticket id is required");
        }
        if (!TicketId.isValid(ticketId)) {
            throw new IllegalArgumentException("invalid ticket id: " + ticketId);
        }
    }
}
