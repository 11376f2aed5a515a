package ticketsync.server.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import ticketsync.server.api.Controller;
import ticketsync.server.api.v1.dto.CreateTicketRequest;
import ticketsync.server.api.v1.dto.TicketListResponse;
import ticketsync.server.api.v1.dto.TicketResponse;
import ticketsync.server.api.v1.dto.UpdateTicketRequest;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;
import ticketsync.server.repository.TicketQuery;
import ticketsync.server.server.RouterHandler;
import ticketsync.server.service.TicketService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for ticket CRUD (public API).
 *
 * GET /api/v1/tickets - List tickets (filters: status, priority, project, assignee; sort, order)
 * POST /api/v1/tickets - Create a ticket
 * GET /api/v1/tickets/{id} - Get one ticket
 * PATCH /api/v1/tickets/{id} - Update a ticket
 * DELETE /api/v1/tickets/{id} - Delete a ticket
 */
public class TicketController implements Controller {

    private static final Pattern TICKETS_PATTERN = Pattern.compile("^/api/v1/tickets$");
    private static final Pattern TICKET_BY_ID_PATTERN = Pattern.compile("^/api/v1/tickets/([^/]+)$");

    private final TicketService ticketService;

    public TicketController(TicketService ticketService) {
        this.ticketService = ticketService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TICKETS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TICKET_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (TICKETS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
        }

        Matcher byId = TICKET_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String ticketId = byId.group(1);
            if (method.equals(HttpMethod.GET)) {
                return handleGet(ticketId);
            }
            if (method.equals(HttpMethod.PATCH)) {
                return handleUpdate(ticketId, req);
            }
            if (method.equals(HttpMethod.DELETE)) {
                ticketService.delete(ticketId);
                return ControllerResponse.noContent();
            }
        }

        return ControllerResponse.notFound("unknown ticket endpoint");
    }

    /**
     * GET /api/v1/tickets
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        TicketQuery query = parseQuery(new QueryStringDecoder(req.uri()).parameters());
        List<Ticket> tickets = ticketService.list(query);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TicketListResponse.from(tickets)));
    }

    /**
     * POST /api/v1/tickets
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTicketRequest request = RouterHandler.mapper().readValue(body, CreateTicketRequest.class);
        request.validate();

        Ticket ticket = ticketService.create(request.toInput());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TicketResponse.from(ticket)));
    }

    private ControllerResponse handleGet(String ticketId) throws Exception {
        Ticket ticket = ticketService.get(ticketId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TicketResponse.from(ticket)));
    }

    /**
     * PATCH /api/v1/tickets/{id}
     */
    private ControllerResponse handleUpdate(String ticketId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        UpdateTicketRequest request = RouterHandler.mapper().readValue(body, UpdateTicketRequest.class);

        Ticket ticket = ticketService.update(ticketId, request.toPatch());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TicketResponse.from(ticket)));
    }

    static TicketQuery parseQuery(Map<String, List<String>> params) {
        TicketQuery query = TicketQuery.all();

        String status = first(params, "status");
        if (status != null) {
            query = query.withStatus(TicketStatus.fromWire(status));
        }
        String priority = first(params, "priority");
        if (priority != null) {
            query = query.withPriority(TicketPriority.fromWire(priority));
        }
        String project = first(params, "project");
        if (project != null) {
            query = query.withProject(project);
        }
        String assignee = first(params, "assignee");
        if (assignee != null) {
            query = query.withAssignee(assignee);
        }

        String sort = first(params, "sort");
        String order = first(params, "order");
        if (sort != null || order != null) {
            query = query.sortedBy(
                    sort != null ? TicketQuery.SortField.parse(sort) : TicketQuery.SortField.ID,
                    order != null ? TicketQuery.SortOrder.parse(order) : TicketQuery.SortOrder.ASC);
        }
        return query;
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
