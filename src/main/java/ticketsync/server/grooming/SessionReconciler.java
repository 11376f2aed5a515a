package ticketsync.server.grooming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.repository.TicketRepository;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Resolves grooming sessions whose agent never reported back.
 *
 * When a session's timer fires and the session is still the one the timer was armed for:
 * 1. re-read the ticket
 * 2. if grooming is still in progress, score the content:
 * - score at or above the completion threshold: mark complete
 * - otherwise: mark failed with "session timeout"
 * 3. drop the session, whatever happened above
 *
 * A ticket deleted in the meantime abandons reconciliation.
 */
public class SessionReconciler {

    private static final Logger log = LoggerFactory.getLogger(SessionReconciler.class);

    static final String TIMEOUT_REASON = "session timeout";

    public enum Result {
        /** The session was replaced or removed before the timer fired */
        STALE,
        /** Grooming was no longer in progress; nothing to resolve */
        ALREADY_RESOLVED,
        COMPLETED,
        TIMED_OUT,
        /** The ticket no longer exists */
        ABANDONED,
        ERROR
    }

    private final TicketRepository repository;
    private final SessionRegistry sessions;
    private final QualityScorer scorer;
    private final GroomingStatusWriter writer;
    private final Clock clock;

    SessionReconciler(TicketRepository repository, SessionRegistry sessions, QualityScorer scorer,
            GroomingStatusWriter writer, Clock clock) {
        this.repository = repository;
        this.sessions = sessions;
        this.scorer = scorer;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Timer body for one session. Logs and never throws.
     */
    public Runnable forSession(String ticketId, String sessionKey) {
        return () -> {
            try {
                reconcile(ticketId, sessionKey);
            } catch (Exception e) {
                log.error("Reconciliation error for {}", ticketId, e);
            }
        };
    }

    public Result reconcile(String ticketId, String sessionKey) {
        return sessions.withLock(ticketId, () -> {
            Optional<GroomingSession> session = sessions.get(ticketId);
            if (session.isEmpty() || !session.get().sessionKey().equals(sessionKey)) {
                log.debug("Session {} for {} is no longer current", sessionKey, ticketId);
                return Result.STALE;
            }

            log.info("Session timeout for {} - checking status", ticketId);
            try {
                return resolve(ticketId);
            } catch (TicketNotFoundException e) {
                log.info("{} was deleted during grooming; abandoning reconciliation", ticketId);
                return Result.ABANDONED;
            } catch (RuntimeException e) {
                log.error("Error reconciling {}: {}", ticketId, e.getMessage());
                return Result.ERROR;
            } finally {
                sessions.remove(ticketId);
            }
        });
    }

    private Result resolve(String ticketId) {
        Ticket ticket = repository.get(ticketId);
        GroomingStatus grooming = ticket.grooming();
        if (grooming == null || grooming.status() != GroomingState.IN_PROGRESS) {
            log.info("{} grooming already resolved ({})", ticketId,
                    grooming == null ? "none" : grooming.status());
            return Result.ALREADY_RESOLVED;
        }

        int score = scorer.score(ticket);
        if (scorer.looksGroomed(ticket)) {
            log.info("{} appears groomed (score={}) - marking complete", ticketId, score);
            writer.apply(ticketId, GroomingStatus.of(GroomingState.COMPLETE)
                    .withCompletedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS)));
            return Result.COMPLETED;
        }

        log.info("{} still incomplete (score={}) - marking failed", ticketId, score);
        writer.apply(ticketId, GroomingStatus.of(GroomingState.FAILED).withLastError(TIMEOUT_REASON));
        return Result.TIMED_OUT;
    }
}
