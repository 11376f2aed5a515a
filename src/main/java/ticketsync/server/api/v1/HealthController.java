package ticketsync.server.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.api.Controller;
import ticketsync.server.api.v1.dto.HealthResponse;
import ticketsync.server.config.ServerConfig;
import ticketsync.server.grooming.GroomingOrchestrator;
import ticketsync.server.hub.BroadcastHub;
import ticketsync.server.server.RouterHandler;
import ticketsync.server.service.TicketService;
import ticketsync.server.watch.ChangeDetector;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final TicketService ticketService;
    private final ChangeDetector changeDetector;
    private final BroadcastHub hub;
    private final GroomingOrchestrator orchestrator;
    private final ServerConfig config;

    public HealthController(TicketService ticketService, ChangeDetector changeDetector, BroadcastHub hub,
            GroomingOrchestrator orchestrator, ServerConfig config) {
        this.ticketService = ticketService;
        this.changeDetector = changeDetector;
        this.hub = hub;
        this.orchestrator = orchestrator;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HealthResponse response;
        try {
            response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    config.vaultPath().toString(),
                    ticketService.count(),
                    changeDetector.isWatching(),
                    hub.subscriberCount(),
                    orchestrator.autoGroomingEnabled(),
                    config.hasAgentToken(),
                    orchestrator.activeSessions().values());
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
