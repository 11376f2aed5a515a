package ticketsync.server.grooming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a freshly created ticket should be groomed automatically.
 *
 * A ticket qualifies only if all of these hold:
 * 1. no grooming is pending or in progress, and no live session exists
 * 2. it is still in the initial status, or has no estimate
 * 3. its body is short, or lacks an implementation-details marker
 * 4. it was created within the age window
 * 5. any previous grooming completed longer ago than the suppression window
 */
public class EligibilityPolicy {

    private static final Logger log = LoggerFactory.getLogger(EligibilityPolicy.class);

    static final int CONTENT_LENGTH_THRESHOLD = 500;
    static final String[] IMPLEMENTATION_MARKERS = {"Implementation Details", "**Implementation"};

    private final Clock clock;
    private final Duration ageWindow;
    private final Duration suppressionWindow;

    public EligibilityPolicy(Clock clock, Duration ageWindow, Duration suppressionWindow) {
        this.clock = clock;
        this.ageWindow = ageWindow;
        this.suppressionWindow = suppressionWindow;
    }

    public boolean shouldEnrich(Ticket ticket, boolean hasLiveSession) {
        return evaluate(ticket, hasLiveSession).eligible();
    }

    /**
     * Evaluate the conditions in order and report the first one that fails.
     */
    public Decision evaluate(Ticket ticket, boolean hasLiveSession) {
        GroomingStatus grooming = ticket.grooming();
        if (grooming != null && grooming.isInFlight()) {
            return skip(ticket, "already " + grooming.status());
        }
        if (hasLiveSession) {
            return skip(ticket, "active local session");
        }

        if (ticket.status() != TicketStatus.INITIAL && ticket.hasEstimate()) {
            return skip(ticket, "not backlog and has estimate");
        }

        int length = ticket.body().length();
        if (length >= CONTENT_LENGTH_THRESHOLD && hasImplementationMarker(ticket.body())) {
            return skip(ticket, "content looks complete (" + length + " chars)");
        }

        Instant now = clock.instant();
        Duration age = Duration.between(ticket.createdAt(), now);
        if (age.compareTo(ageWindow) >= 0) {
            return skip(ticket, "too old (" + age.toSeconds() + "s)");
        }

        if (grooming != null && grooming.completedAt() != null) {
            Duration sinceCompleted = Duration.between(grooming.completedAt(), now);
            if (sinceCompleted.compareTo(suppressionWindow) < 0) {
                return skip(ticket, "recently groomed (" + sinceCompleted.toSeconds() + "s ago)");
            }
        }

        log.info("{} qualifies for auto-grooming (status={}, estimate={}, {} chars, age {}s)",
                ticket.id(), ticket.status(), ticket.estimate(), length, age.toSeconds());
        return new Decision(true, null);
    }

    static boolean hasImplementationMarker(String body) {
        for (String marker : IMPLEMENTATION_MARKERS) {
            if (body.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static Decision skip(Ticket ticket, String reason) {
        log.debug("Skipping {}: {}", ticket.id(), reason);
        return new Decision(false, reason);
    }

    /**
     * @param eligible whether grooming should start
     * @param reason   why not, when not eligible
     */
    public record Decision(boolean eligible, String reason) {
    }
}
