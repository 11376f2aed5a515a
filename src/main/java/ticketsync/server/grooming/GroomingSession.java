package ticketsync.server.grooming;

import java.time.Instant;

/**
 * In-memory record of one grooming run the gateway has accepted.
 */
public record GroomingSession(String ticketId, String sessionKey, Instant startedAt) {
}
