package ticketsync.server.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.api.Controller;
import ticketsync.server.api.v1.dto.GroomingTriggerResponse;
import ticketsync.server.grooming.GroomingOrchestrator;
import ticketsync.server.grooming.GroomingOutcome;
import ticketsync.server.model.TicketId;
import ticketsync.server.server.RouterHandler;

import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manual grooming trigger.
 * POST /api/v1/tickets/{id}/groom
 *
 * Waits for the trigger to resolve (including retries), then answers 200 when the agent run
 * started and 400 when it was rejected or failed.
 */
public class GroomingController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GroomingController.class);

    private static final Pattern GROOM_PATTERN = Pattern.compile("^/api/v1/tickets/([^/]+)/groom$");

    private final GroomingOrchestrator orchestrator;

    public GroomingController(GroomingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && GROOM_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = GROOM_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown grooming endpoint");
        }
        String ticketId = m.group(1);
        if (!TicketId.isValid(ticketId)) {
            throw new IllegalArgumentException("invalid ticket id: " + ticketId);
        }

        GroomingOutcome outcome;
        try {
            outcome = orchestrator.triggerManual(ticketId).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        log.info("Manual grooming of {}: {}", ticketId, outcome.result());
        HttpResponseStatus status = outcome.success() ? HttpResponseStatus.OK : HttpResponseStatus.BAD_REQUEST;
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(GroomingTriggerResponse.from(outcome)));
    }
}
