package ticketsync.server.grooming;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketStatus;
import ticketsync.server.support.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the auto-grooming eligibility rules.
 */
class EligibilityPolicyTest {

    private static final Instant CREATED = Instant.parse("2025-04-01T10:00:00Z");

    private MutableClock clock;
    private EligibilityPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CREATED.plusSeconds(30));
        policy = new EligibilityPolicy(clock, Duration.ofMinutes(5), Duration.ofMinutes(10));
    }

    private static Ticket.Builder fresh() {
        return Ticket.builder()
                .id("TICK-001")
                .title("New idea")
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .body("Short description");
    }

    @Test
    void freshBacklogTicketQualifies() {
        assertTrue(policy.shouldEnrich(fresh().build(), false));
    }

    @Test
    void inFlightGroomingIsSkipped() {
        Ticket pending = fresh().grooming(GroomingStatus.of(GroomingState.PENDING)).build();
        Ticket live = fresh().grooming(GroomingStatus.of(GroomingState.IN_PROGRESS)).build();

        assertFalse(policy.shouldEnrich(pending, false));
        assertFalse(policy.shouldEnrich(live, false));
    }

    @Test
    void liveLocalSessionIsSkipped() {
        EligibilityPolicy.Decision decision = policy.evaluate(fresh().build(), true);

        assertFalse(decision.eligible());
        assertEquals("active local session", decision.reason());
    }

    @Test
    void estimatedTicketOutsideBacklogIsSkipped() {
        assertFalse(policy.shouldEnrich(fresh().status(TicketStatus.TODO).estimate(3.0).build(), false));
        assertFalse(policy.shouldEnrich(fresh().status(TicketStatus.TODO).estimate(0.0).build(), false));
    }

    @Test
    void backlogWithEstimateOrOtherStatusWithoutEstimateQualify() {
        assertTrue(policy.shouldEnrich(fresh().estimate(3.0).build(), false));
        assertTrue(policy.shouldEnrich(fresh().status(TicketStatus.TODO).build(), false));
    }

    @Test
    void longBodyNeedsMarkerToBeSkipped() {
        String filler = "x".repeat(600);

        assertTrue(policy.shouldEnrich(fresh().body(filler).build(), false));
        assertFalse(policy.shouldEnrich(fresh().body(filler + "\n## Implementation Details\n").build(), false));
        assertFalse(policy.shouldEnrich(fresh().body(filler + "\n**Implementation:** phased").build(), false));
        assertTrue(policy.shouldEnrich(fresh().body("## Implementation Details").build(), false));
    }

    @Test
    void oldTicketIsSkipped() {
        clock.set(CREATED.plus(Duration.ofMinutes(5)));
        assertFalse(policy.shouldEnrich(fresh().build(), false));

        clock.set(CREATED.plus(Duration.ofMinutes(5)).minusMillis(1));
        assertTrue(policy.shouldEnrich(fresh().build(), false));
    }

    @Test
    void recentlyCompletedGroomingIsSuppressed() {
        Ticket recent = fresh()
                .grooming(GroomingStatus.of(GroomingState.COMPLETE).withCompletedAt(clock.instant().minusSeconds(60)))
                .build();
        Ticket longAgo = fresh()
                .grooming(GroomingStatus.of(GroomingState.COMPLETE).withCompletedAt(clock.instant().minus(Duration.ofHours(1))))
                .build();

        assertFalse(policy.shouldEnrich(recent, false));
        assertTrue(policy.shouldEnrich(longAgo, false));
    }

    @Test
    void failedGroomingMayBeRetried() {
        Ticket failed = fresh().grooming(GroomingStatus.of(GroomingState.FAILED).withAttempts(1)).build();

        assertTrue(policy.shouldEnrich(failed, false));
    }
}
