package ticketsync.server.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.api.Controller;
import ticketsync.server.api.internal.v1.dto.GroomingFailRequest;
import ticketsync.server.api.internal.v1.dto.OperationResponse;
import ticketsync.server.grooming.GroomingOrchestrator;
import ticketsync.server.model.TicketId;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.server.RouterHandler;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Completion reporting for grooming agents (internal API).
 *
 * POST /internal/v1/grooming/{id}/complete - Agent finished
 * POST /internal/v1/grooming/{id}/fail - Agent gave up (body: {"error": "..."})
 */
public class GroomingCallbackController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GroomingCallbackController.class);

    private static final Pattern CALLBACK_PATTERN =
            Pattern.compile("^/internal/v1/grooming/([^/]+)/(complete|fail)$");

    private final GroomingOrchestrator orchestrator;

    public GroomingCallbackController(GroomingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && CALLBACK_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher m = CALLBACK_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown grooming endpoint");
        }
        String ticketId = m.group(1);
        if (!TicketId.isValid(ticketId)) {
            throw new IllegalArgumentException("invalid ticket id: " + ticketId);
        }

        try {
            if ("complete".equals(m.group(2))) {
                orchestrator.markComplete(ticketId);
                log.info("Agent reported grooming complete for {}", ticketId);
            } else {
                String body = req.content().toString(StandardCharsets.UTF_8);
                GroomingFailRequest request = RouterHandler.mapper().readValue(body, GroomingFailRequest.class);
                request.validate();
                orchestrator.markFailed(ticketId, request.error());
                log.info("Agent reported grooming failure for {}: {}", ticketId, request.error());
            }
        } catch (TicketNotFoundException e) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.ticketNotFound()));
        }

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }
}
