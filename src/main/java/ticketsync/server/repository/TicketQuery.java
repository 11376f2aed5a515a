package ticketsync.server.repository;

import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

import java.util.Comparator;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Filter and sort options for listing tickets. Filters are field equality and combine with AND.
 */
public record TicketQuery(
        TicketStatus status,
        TicketPriority priority,
        String project,
        String assignee,
        SortField sort,
        SortOrder order) {

    public enum SortField {
        ID, PRIORITY, CREATED_AT, UPDATED_AT;

        public static SortField parse(String value) {
            return switch (value) {
                case "id" -> ID;
                case "priority" -> PRIORITY;
                case "createdAt" -> CREATED_AT;
                case "updatedAt" -> UPDATED_AT;
                default -> throw new IllegalArgumentException("Invalid sort field: " + value);
            };
        }
    }

    public enum SortOrder {
        ASC, DESC;

        public static SortOrder parse(String value) {
            try {
                return valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid sort order: " + value);
            }
        }
    }

    public TicketQuery {
        if (sort == null)
            sort = SortField.ID;
        if (order == null)
            order = SortOrder.ASC;
    }

    /** No filters, ascending by id */
    public static TicketQuery all() {
        return new TicketQuery(null, null, null, null, null, null);
    }

    public TicketQuery withStatus(TicketStatus s) {
        return new TicketQuery(s, priority, project, assignee, sort, order);
    }

    public TicketQuery withPriority(TicketPriority p) {
        return new TicketQuery(status, p, project, assignee, sort, order);
    }

    public TicketQuery withProject(String p) {
        return new TicketQuery(status, priority, p, assignee, sort, order);
    }

    public TicketQuery withAssignee(String a) {
        return new TicketQuery(status, priority, project, a, sort, order);
    }

    public TicketQuery sortedBy(SortField field, SortOrder sortOrder) {
        return new TicketQuery(status, priority, project, assignee, field, sortOrder);
    }

    public Predicate<Ticket> filter() {
        return t -> (status == null || status == t.status())
                && (priority == null || priority == t.priority())
                && (project == null || project.equals(t.project()))
                && (assignee == null || assignee.equals(t.assignee()));
    }

    /** Comparator for the requested field and order; use with a stable sort */
    public Comparator<Ticket> comparator() {
        Comparator<Ticket> c = switch (sort) {
            case PRIORITY -> Comparator.comparingInt(t -> t.priority().rank());
            case CREATED_AT -> Comparator.comparing(Ticket::createdAt);
            case UPDATED_AT -> Comparator.comparing(Ticket::updatedAt);
            case ID -> Comparator.comparingInt(Ticket::number);
        };
        return order == SortOrder.DESC ? c.reversed() : c;
    }
}
