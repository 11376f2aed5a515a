package ticketsync.server.grooming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.agent.AgentClient;
import ticketsync.server.agent.AgentPreconditionException;
import ticketsync.server.agent.AgentRequest;
import ticketsync.server.config.ServerConfig;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.repository.TicketRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Drives automatic and manual grooming of tickets through an external agent.
 *
 * Grooming status lifecycle (persisted in the ticket):
 * - none / terminal -> pending: trigger accepted locally
 * - pending -> in-progress: gateway accepted the run, a session is live
 * - in-progress -> complete | failed: reported by the agent or resolved by reconciliation
 * - pending -> failed: every invocation attempt failed
 *
 * Created-ticket ids arrive on an inbound queue drained by one dispatcher thread; each trigger
 * then runs on a worker so retries for one ticket never hold up another. Reconciliation timers
 * run on a separate scheduler.
 */
public class GroomingOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GroomingOrchestrator.class);

    static final String ALREADY_IN_PROGRESS = "Grooming already in progress";

    private final TicketRepository repository;
    private final AgentClient agentClient;
    private final ServerConfig config;
    private final Clock clock;

    private final SessionRegistry sessions = new SessionRegistry();
    private final EligibilityPolicy policy;
    private final QualityScorer scorer = new QualityScorer();
    private final GroomingTaskBuilder taskBuilder;
    private final GroomingStatusWriter writer;
    private final SessionReconciler reconciler;

    private final BlockingQueue<String> created = new LinkedBlockingQueue<>();
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;

    private volatile boolean running = false;
    private Thread dispatcher;

    public GroomingOrchestrator(TicketRepository repository, AgentClient agentClient, ServerConfig config,
            Clock clock) {
        this.repository = repository;
        this.agentClient = agentClient;
        this.config = config;
        this.clock = clock;
        this.policy = new EligibilityPolicy(clock, config.groomingAgeWindow(), config.suppressionWindow());
        this.taskBuilder = new GroomingTaskBuilder(config.vaultPath());
        this.writer = new GroomingStatusWriter(repository);
        this.reconciler = new SessionReconciler(repository, sessions, scorer, writer, clock);

        AtomicInteger workerCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "grooming-worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "grooming-reconciler");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("Grooming orchestrator already running");
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "grooming-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Grooming orchestrator started (auto-grooming {})",
                config.autoGroomingEnabled() ? "enabled" : "disabled");
    }

    /**
     * Stop accepting work. Outstanding retry loops and timers are interrupted, not awaited.
     */
    public synchronized void shutdown() {
        boolean wasRunning = running;
        running = false;
        if (dispatcher != null) {
            dispatcher.interrupt();
        }
        workers.shutdownNow();
        timers.shutdownNow();
        if (wasRunning) {
            log.info("Grooming orchestrator stopped ({} live sessions dropped)", sessions.size());
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Queue a newly created ticket for the auto-grooming check. Returns immediately.
     */
    public void onTicketCreated(String ticketId) {
        created.add(ticketId);
    }

    /**
     * Trigger grooming regardless of eligibility, unless a run is already pending or live.
     * The future fails with {@link TicketNotFoundException} for an unknown ticket.
     */
    public CompletableFuture<GroomingOutcome> triggerManual(String ticketId) {
        return CompletableFuture.supplyAsync(() -> groomManually(ticketId), workers);
    }

    /**
     * Record that the agent finished: drops the session and marks grooming complete.
     *
     * @throws TicketNotFoundException if the ticket does not exist
     */
    public void markComplete(String ticketId) {
        sessions.runLocked(ticketId, () -> {
            sessions.remove(ticketId);
            writer.apply(ticketId, GroomingStatus.of(GroomingState.COMPLETE).withCompletedAt(now()));
        });
    }

    /**
     * Record that the agent failed: drops the session and marks grooming failed.
     *
     * @throws TicketNotFoundException if the ticket does not exist
     */
    public void markFailed(String ticketId, String reason) {
        sessions.runLocked(ticketId, () -> {
            sessions.remove(ticketId);
            writer.apply(ticketId, GroomingStatus.of(GroomingState.FAILED).withLastError(reason));
        });
    }

    /** Snapshot of live sessions for monitoring */
    public Map<String, GroomingSession> activeSessions() {
        return sessions.snapshot();
    }

    public boolean autoGroomingEnabled() {
        return config.autoGroomingEnabled();
    }

    SessionRegistry sessions() {
        return sessions;
    }

    SessionReconciler reconciler() {
        return reconciler;
    }

    private void dispatchLoop() {
        while (running) {
            String ticketId;
            try {
                ticketId = created.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                workers.execute(() -> groomIfEligible(ticketId));
            } catch (RejectedExecutionException e) {
                log.debug("Dropping {}: orchestrator shutting down", ticketId);
            }
        }
    }

    /**
     * Auto-grooming entry point for a created ticket. Logs and never throws.
     */
    GroomingOutcome groomIfEligible(String ticketId) {
        if (!config.autoGroomingEnabled()) {
            log.debug("Auto-grooming disabled, ignoring {}", ticketId);
            return GroomingOutcome.skipped("auto-grooming disabled");
        }
        try {
            String[] reason = new String[1];
            Ticket claimed = claim(ticketId, ticket -> {
                EligibilityPolicy.Decision decision = policy.evaluate(ticket, sessions.has(ticketId));
                reason[0] = decision.reason();
                return decision.eligible();
            });
            if (claimed == null) {
                return GroomingOutcome.skipped(reason[0]);
            }
            log.info("Auto-grooming {}", ticketId);
            return invoke(claimed);
        } catch (TicketNotFoundException e) {
            log.info("{} disappeared before grooming", ticketId);
            return GroomingOutcome.skipped(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error handling new ticket {}", ticketId, e);
            return GroomingOutcome.failed(e.getMessage());
        }
    }

    private GroomingOutcome groomManually(String ticketId) {
        Ticket claimed = claim(ticketId, ticket -> {
            GroomingStatus grooming = ticket.grooming();
            return !(grooming != null && grooming.isInFlight()) && !sessions.has(ticketId);
        });
        if (claimed == null) {
            log.info("Manual grooming of {} rejected: already in progress", ticketId);
            return GroomingOutcome.rejected(ALREADY_IN_PROGRESS);
        }
        log.info("Manual grooming of {}", ticketId);
        return invoke(claimed);
    }

    /**
     * Under the ticket lock: re-read the ticket, apply {@code guard}, and if it passes write
     * grooming status pending with an incremented attempt counter.
     *
     * @return the ticket as written, or null if the guard refused
     */
    private Ticket claim(String ticketId, Predicate<Ticket> guard) {
        return sessions.withLock(ticketId, () -> {
            Ticket ticket = repository.get(ticketId);
            if (!guard.test(ticket)) {
                return null;
            }
            int attempts = (ticket.grooming() == null ? 0 : ticket.grooming().attemptCount()) + 1;
            return writer.apply(ticketId, GroomingStatus.of(GroomingState.PENDING)
                    .withTriggeredAt(now())
                    .withAttempts(attempts));
        });
    }

    /**
     * Invoke the agent with retries, outside any lock.
     */
    private GroomingOutcome invoke(Ticket ticket) {
        String ticketId = ticket.id();
        int attempts = ticket.grooming().attemptCount();
        String sessionKey = "groom-" + ticketId + "-" + clock.millis();
        AgentRequest request = AgentRequest.groom(ticketId, taskBuilder.build(ticket));
        int maxAttempts = config.maxGroomingAttempts();

        String lastError = "no attempts made";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.info("Triggering grooming for {} (attempt {}/{})", ticketId, attempt, maxAttempts);
                agentClient.invoke(request);
                return activate(ticketId, sessionKey);
            } catch (AgentPreconditionException e) {
                lastError = e.getMessage();
                log.error("Cannot groom {}: {}", ticketId, lastError);
                break;
            } catch (RuntimeException e) {
                lastError = e.getMessage() != null ? e.getMessage() : e.toString();
                log.warn("Attempt {} failed for {}: {}", attempt, ticketId, lastError);
            }

            if (attempt < maxAttempts) {
                try {
                    log.info("Retrying {} in {}ms", ticketId, config.groomingRetryDelay().toMillis());
                    Thread.sleep(config.groomingRetryDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "Grooming interrupted by shutdown";
                    break;
                }
            }
        }

        log.error("Grooming failed for {}: {}", ticketId, lastError);
        String error = lastError;
        sessions.runLocked(ticketId, () -> writer.applyQuietly(ticketId,
                GroomingStatus.of(GroomingState.FAILED).withLastError(error).withAttempts(attempts)));
        return GroomingOutcome.failed(error);
    }

    private GroomingOutcome activate(String ticketId, String sessionKey) {
        sessions.runLocked(ticketId, () -> {
            sessions.put(new GroomingSession(ticketId, sessionKey, now()));
            writer.applyQuietly(ticketId, GroomingStatus.of(GroomingState.IN_PROGRESS)
                    .withTriggeredAt(now())
                    .withSessionKey(sessionKey));
        });
        try {
            timers.schedule(reconciler.forSession(ticketId, sessionKey),
                    config.reconcileDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Not scheduling reconciliation for {}: orchestrator shutting down", ticketId);
        }
        log.info("Grooming triggered for {} (session {})", ticketId, sessionKey);
        return GroomingOutcome.triggered(sessionKey);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
