package ticketsync.server.grooming;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ticketsync.server.agent.AgentRequest;
import ticketsync.server.config.ServerConfig;
import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.store.FileTicketRepository;
import ticketsync.server.store.MarkdownTicketCodec;
import ticketsync.server.support.Await;
import ticketsync.server.support.FakeAgentClient;
import ticketsync.server.support.MutableClock;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GroomingOrchestrator with a fake agent and a controllable clock.
 */
class GroomingOrchestratorTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private FileTicketRepository repository;
    private FakeAgentClient agent;
    private ServerConfig config;
    private GroomingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-05-01T09:00:00Z");
        repository = new FileTicketRepository(dir, new MarkdownTicketCodec(), clock);
        agent = new FakeAgentClient();
        config = ServerConfig.defaults()
                .withVaultPath(dir)
                .withGroomingRetryDelay(Duration.ofMillis(10))
                .withReconcileDelay(Duration.ofHours(1));
        orchestrator = new GroomingOrchestrator(repository, agent, config, clock);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private Ticket newTicket() {
        return repository.create(CreateTicketInput.of("Add export"));
    }

    private GroomingStatus grooming(String id) {
        return repository.get(id).grooming();
    }

    @Test
    void eligibleTicketStartsSession() {
        Ticket ticket = newTicket();

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.TRIGGERED, outcome.result());
        assertTrue(outcome.sessionKey().startsWith("groom-TICK-001-"));
        GroomingStatus grooming = grooming(ticket.id());
        assertEquals(GroomingState.IN_PROGRESS, grooming.status());
        assertEquals(outcome.sessionKey(), grooming.sessionKey());
        assertEquals(1, grooming.attemptCount());
        assertNotNull(grooming.triggeredAt());
        assertEquals(1, orchestrator.activeSessions().size());
    }

    @Test
    void requestCarriesGroomingTask() {
        Ticket ticket = newTicket();

        orchestrator.groomIfEligible(ticket.id());

        AgentRequest request = agent.requests().get(0);
        assertEquals("TICK-001", request.ticketId());
        assertEquals("groom-TICK-001", request.label());
        assertTrue(request.task().startsWith("Groom ticket TICK-001: \"Add export\""));
        assertTrue(request.task().contains(dir.resolve("TICK-001.md").toAbsolutePath().normalize().toString()));
    }

    @Test
    void secondTriggerIsSkippedWhileSessionLive() {
        Ticket ticket = newTicket();
        orchestrator.groomIfEligible(ticket.id());

        GroomingOutcome second = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.SKIPPED, second.result());
        assertEquals(1, agent.calls());
        assertEquals(1, orchestrator.activeSessions().size());
    }

    @Test
    void oldTicketIsNotAutoGroomed() {
        Ticket ticket = newTicket();
        clock.advance(Duration.ofMinutes(6));

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.SKIPPED, outcome.result());
        assertEquals(0, agent.calls());
        assertNull(grooming(ticket.id()));
    }

    @Test
    void disabledAutoGroomingSkips() {
        config.withAutoGrooming(false);
        Ticket ticket = newTicket();

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.SKIPPED, outcome.result());
        assertEquals(0, agent.calls());
    }

    @Test
    void missingTicketIsSkipped() {
        assertEquals(GroomingOutcome.Result.SKIPPED, orchestrator.groomIfEligible("TICK-404").result());
    }

    @Test
    void transientFailuresAreRetried() {
        agent.failNext(2, "Gateway returned 502: bad gateway");
        Ticket ticket = newTicket();

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertTrue(outcome.success());
        assertEquals(3, agent.calls());
        assertEquals(GroomingState.IN_PROGRESS, grooming(ticket.id()).status());
    }

    @Test
    void exhaustedRetriesMarkFailed() {
        agent.alwaysFail("Gateway returned 500: boom");
        Ticket ticket = newTicket();

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.FAILED, outcome.result());
        assertEquals(3, agent.calls());
        GroomingStatus grooming = grooming(ticket.id());
        assertEquals(GroomingState.FAILED, grooming.status());
        assertEquals("Gateway returned 500: boom", grooming.lastError());
        assertEquals(1, grooming.attemptCount());
        assertTrue(orchestrator.activeSessions().isEmpty());
    }

    @Test
    void missingTokenFailsWithoutRetry() {
        agent.missingToken("Agent token not configured - cannot spawn grooming agent");
        Ticket ticket = newTicket();

        GroomingOutcome outcome = orchestrator.groomIfEligible(ticket.id());

        assertEquals(GroomingOutcome.Result.FAILED, outcome.result());
        assertEquals(1, agent.calls());
        assertEquals("Agent token not configured - cannot spawn grooming agent", grooming(ticket.id()).lastError());
    }

    @Test
    void manualTriggerBypassesEligibility() throws Exception {
        Ticket ticket = newTicket();
        clock.advance(Duration.ofHours(2));

        GroomingOutcome outcome = orchestrator.triggerManual(ticket.id()).get(5, TimeUnit.SECONDS);

        assertTrue(outcome.success());
        assertEquals(GroomingState.IN_PROGRESS, grooming(ticket.id()).status());
    }

    @Test
    void manualTriggerRejectedWhileInFlight() throws Exception {
        Ticket ticket = newTicket();
        orchestrator.groomIfEligible(ticket.id());

        GroomingOutcome outcome = orchestrator.triggerManual(ticket.id()).get(5, TimeUnit.SECONDS);

        assertEquals(GroomingOutcome.Result.REJECTED, outcome.result());
        assertEquals("Grooming already in progress", outcome.error());
        assertEquals(1, agent.calls());
    }

    @Test
    void manualTriggerRejectedWhilePending() throws Exception {
        Ticket ticket = newTicket();
        repository.update(ticket.id(), TicketPatch.grooming(GroomingStatus.of(GroomingState.PENDING)));

        GroomingOutcome outcome = orchestrator.triggerManual(ticket.id()).get(5, TimeUnit.SECONDS);

        assertEquals(GroomingOutcome.Result.REJECTED, outcome.result());
        assertEquals(0, agent.calls());
    }

    @Test
    void manualTriggerForUnknownTicketFails() {
        CompletionException e = assertThrows(CompletionException.class,
                () -> orchestrator.triggerManual("TICK-404").join());

        assertInstanceOf(TicketNotFoundException.class, e.getCause());
    }

    @Test
    void attemptsCountEveryTrigger() throws Exception {
        agent.failNext(3, "Gateway returned 500: boom");
        Ticket ticket = newTicket();
        orchestrator.groomIfEligible(ticket.id());

        orchestrator.triggerManual(ticket.id()).get(5, TimeUnit.SECONDS);

        assertEquals(2, grooming(ticket.id()).attemptCount());
        assertEquals(GroomingState.IN_PROGRESS, grooming(ticket.id()).status());
    }

    @Test
    void markCompleteClearsSession() {
        Ticket ticket = newTicket();
        orchestrator.groomIfEligible(ticket.id());
        clock.advance(Duration.ofMinutes(3));

        orchestrator.markComplete(ticket.id());

        GroomingStatus grooming = grooming(ticket.id());
        assertEquals(GroomingState.COMPLETE, grooming.status());
        assertEquals(clock.instant(), grooming.completedAt());
        assertNotNull(grooming.sessionKey());
        assertTrue(orchestrator.activeSessions().isEmpty());
    }

    @Test
    void markFailedRecordsReason() {
        Ticket ticket = newTicket();
        orchestrator.groomIfEligible(ticket.id());

        orchestrator.markFailed(ticket.id(), "agent crashed");

        assertEquals(GroomingState.FAILED, grooming(ticket.id()).status());
        assertEquals("agent crashed", grooming(ticket.id()).lastError());
        assertTrue(orchestrator.activeSessions().isEmpty());
    }

    @Test
    void callbacksForUnknownTicketThrow() {
        assertThrows(TicketNotFoundException.class, () -> orchestrator.markComplete("TICK-404"));
        assertThrows(TicketNotFoundException.class, () -> orchestrator.markFailed("TICK-404", "x"));
    }

    @Test
    void createdTicketsAreDispatched() {
        orchestrator.start();
        Ticket ticket = newTicket();

        orchestrator.onTicketCreated(ticket.id());

        Await.until(() -> orchestrator.activeSessions().containsKey(ticket.id()), "session to start");
        assertEquals(1, agent.calls());
    }

    @Test
    void duplicateCreateEventsStartOneSession() {
        orchestrator.start();
        Ticket ticket = newTicket();

        for (int i = 0; i < 5; i++) {
            orchestrator.onTicketCreated(ticket.id());
        }

        Await.until(() -> orchestrator.activeSessions().containsKey(ticket.id()), "session to start");
        // let the remaining dispatches settle
        Await.until(() -> grooming(ticket.id()).status() == GroomingState.IN_PROGRESS, "in-progress status");
        assertEquals(1, agent.calls());
        assertEquals(1, grooming(ticket.id()).attemptCount());
    }
}
