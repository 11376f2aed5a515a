package ticketsync.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.agent.AgentClient;
import ticketsync.server.agent.HttpAgentClient;
import ticketsync.server.api.internal.v1.GroomingCallbackController;
import ticketsync.server.api.v1.GroomingController;
import ticketsync.server.api.v1.HealthController;
import ticketsync.server.api.v1.TicketController;
import ticketsync.server.core.TicketEventPump;
import ticketsync.server.grooming.GroomingOrchestrator;
import ticketsync.server.hub.BroadcastHub;
import ticketsync.server.repository.TicketRepository;
import ticketsync.server.server.RouterHandler;
import ticketsync.server.service.TicketService;
import ticketsync.server.store.FileTicketRepository;
import ticketsync.server.store.MarkdownTicketCodec;
import ticketsync.server.watch.ChangeDetector;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ServerConfig.fromEnv());
 * deps.start(); // watcher, hub, orchestrator, event pump
 * TicketSyncServer server = new TicketSyncServer(deps.config(), deps.routerHandler(), deps.broadcastHub());
 * // ... serve ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ServerConfig config;
    private final TicketRepository ticketRepository;
    private final TicketService ticketService;
    private final ChangeDetector changeDetector;
    private final BroadcastHub broadcastHub;
    private final AgentClient agentClient;
    private final GroomingOrchestrator groomingOrchestrator;
    private final TicketEventPump eventPump;

    // Controllers
    private final HealthController healthController;
    private final TicketController ticketController;
    private final GroomingController groomingController;
    private final GroomingCallbackController groomingCallbackController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private boolean started = false;

    private Dependencies(ServerConfig config, AgentClient agentClient, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        this.ticketRepository = new FileTicketRepository(config.vaultPath(), new MarkdownTicketCodec(), clock);
        this.ticketService = new TicketService(ticketRepository);

        // Event flow: detector -> pump -> hub / orchestrator
        this.changeDetector = new ChangeDetector(config.stabilityWindow());
        this.broadcastHub = new BroadcastHub(ticketRepository, RouterHandler.mapper());
        this.agentClient = agentClient != null
                ? agentClient
                : new HttpAgentClient(config.agentGatewayUrl(), config.agentToken(), RouterHandler.mapper());
        this.groomingOrchestrator = new GroomingOrchestrator(ticketRepository, this.agentClient, config, clock);
        this.eventPump = new TicketEventPump(changeDetector.events(), ticketRepository, broadcastHub,
                groomingOrchestrator);

        // Controllers (public API)
        this.healthController = new HealthController(ticketService, changeDetector, broadcastHub,
                groomingOrchestrator, config);
        this.ticketController = new TicketController(ticketService);
        this.groomingController = new GroomingController(groomingOrchestrator);

        // Controllers (internal API)
        this.groomingCallbackController = new GroomingCallbackController(groomingOrchestrator);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(ServerConfig config) {
        return new Dependencies(config, null, Clock.systemUTC());
    }

    /**
     * Create dependencies with a specific agent client and clock (tests).
     */
    public static Dependencies create(ServerConfig config, AgentClient agentClient, Clock clock) {
        return new Dependencies(config, agentClient, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ServerConfig.fromEnv());
    }

    /**
     * Start background components: watcher first, then the consumers of its events.
     *
     * @throws ticketsync.server.watch.WatchSetupException if the ticket directory cannot be watched
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        changeDetector.start(config.vaultPath());
        broadcastHub.start();
        groomingOrchestrator.start();
        eventPump.start();
        started = true;
        log.info("Background components started");
    }

    // Getters
    public ServerConfig config() {
        return config;
    }

    public TicketRepository ticketRepository() {
        return ticketRepository;
    }

    public TicketService ticketService() {
        return ticketService;
    }

    public ChangeDetector changeDetector() {
        return changeDetector;
    }

    public BroadcastHub broadcastHub() {
        return broadcastHub;
    }

    public AgentClient agentClient() {
        return agentClient;
    }

    public GroomingOrchestrator groomingOrchestrator() {
        return groomingOrchestrator;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(groomingController)
                    .registerController(ticketController)
                    .registerController(groomingCallbackController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        // Stop the watch handle first so no new events arrive
        stopQuietly("change detector", changeDetector::stop);
        stopQuietly("event pump", eventPump::stop);
        stopQuietly("broadcast hub", broadcastHub::stop);
        stopQuietly("grooming orchestrator", groomingOrchestrator::shutdown);
        started = false;

        log.info("Dependencies closed");
    }

    private static void stopQuietly(String name, Runnable stop) {
        try {
            stop.run();
        } catch (Exception e) {
            log.warn("Error stopping {}: {}", name, e.getMessage());
        }
    }
}
