package ticketsync.server.grooming;

import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketId;

import java.nio.file.Path;

/**
 * Builds the instructions handed to the grooming agent.
 */
public class GroomingTaskBuilder {

    private final Path ticketDirectory;

    public GroomingTaskBuilder(Path ticketDirectory) {
        this.ticketDirectory = ticketDirectory;
    }

    public String build(Ticket ticket) {
        Path file = ticketDirectory.resolve(TicketId.fileName(ticket.id())).toAbsolutePath().normalize();
        return """
                Groom ticket %s: "%s"

                Read the ticket file at: %s

                This ticket needs grooming. Please:
                1. Read the current ticket content
                2. Load relevant project context
                3. Expand the ticket with:
                   - Technical implementation details (phased approach)
                   - Detailed acceptance criteria (testable)
                   - Dependencies on other tickets/systems
                   - Story point estimate (1, 2, 3, 5, 8, 13)
                   - Success metrics
                   - Edge cases to consider
                4. Update the ticket file with the groomed content
                5. Set grooming.status to 'complete' and add a grooming.completedAt timestamp

                Current ticket info:
                - Project: %s
                - Status: %s
                - Priority: %s
                - Current content length: %d chars
                """.formatted(
                ticket.id(),
                ticket.title(),
                file,
                ticket.project(),
                ticket.status(),
                ticket.priority(),
                ticket.body().length());
    }
}
