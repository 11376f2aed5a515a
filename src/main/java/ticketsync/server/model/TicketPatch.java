package ticketsync.server.model;

/**
 * Partial update for a ticket. Null fields leave the current value untouched; the id can never
 * be changed through a patch.
 */
public record TicketPatch(
        String title,
        TicketStatus status,
        TicketPriority priority,
        String project,
        String assignee,
        Double estimate,
        String body,
        GroomingStatus grooming) {

    public static TicketPatch empty() {
        return new TicketPatch(null, null, null, null, null, null, null, null);
    }

    public static TicketPatch grooming(GroomingStatus grooming) {
        return new TicketPatch(null, null, null, null, null, null, null, grooming);
    }

    public void validate() {
        if (title != null && title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (estimate != null && (estimate.isNaN() || estimate < 0)) {
            throw new IllegalArgumentException("estimate must be a non-negative number");
        }
        if (grooming != null) {
            grooming.validate();
        }
    }

    /** Apply this patch to {@code existing}; timestamps are the caller's concern */
    public Ticket.Builder applyTo(Ticket existing) {
        Ticket.Builder b = existing.toBuilder();
        if (title != null)
            b.title(title);
        if (status != null)
            b.status(status);
        if (priority != null)
            b.priority(priority);
        if (project != null)
            b.project(project);
        if (assignee != null)
            b.assignee(assignee);
        if (estimate != null)
            b.estimate(estimate);
        if (body != null)
            b.body(body);
        if (grooming != null)
            b.grooming(grooming);
        return b;
    }
}
