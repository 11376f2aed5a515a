package ticketsync.server.model;

/**
 * Fields accepted when creating a ticket. Missing status, priority and project fall back to
 * {@code backlog}, {@code medium} and {@code Uncategorized}.
 */
public record CreateTicketInput(
        String title,
        TicketStatus status,
        TicketPriority priority,
        String project,
        String assignee,
        Double estimate,
        String body) {

    public static final String DEFAULT_PROJECT = "Uncategorized";

    public static CreateTicketInput of(String title) {
        return new CreateTicketInput(title, null, null, null, null, null, null);
    }

    public void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (estimate != null && (estimate.isNaN() || estimate < 0)) {
            throw new IllegalArgumentException("estimate must be a non-negative number");
        }
    }

    public TicketStatus statusOrDefault() {
        return status != null ? status : TicketStatus.INITIAL;
    }

    public TicketPriority priorityOrDefault() {
        return priority != null ? priority : TicketPriority.MEDIUM;
    }

    public String projectOrDefault() {
        return project != null ? project : DEFAULT_PROJECT;
    }

    public String bodyOrDefault() {
        return body != null ? body : "";
    }
}
