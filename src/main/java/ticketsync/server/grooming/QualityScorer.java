package ticketsync.server.grooming;

import ticketsync.server.model.Ticket;

/**
 * Additive 0-100 completeness score of a ticket's content. Only used to resolve grooming runs
 * that never reported back.
 */
public final class QualityScorer {

    public static final int COMPLETION_THRESHOLD = 60;

    static final int LONG_BODY_THRESHOLD = 2000;

    public int score(Ticket ticket) {
        String body = ticket.body();
        int score = 0;

        if (ticket.hasEstimate()) score += 20;
        if (containsAny(body, "**Tasks:**", "## Tasks")) score += 15;
        if (containsAny(body, "**Acceptance Criteria:**", "## Acceptance")) score += 20;
        if (containsAny(body, "**Dependencies:**", "## Dependencies")) score += 15;
        if (containsAny(body, "**Success Metrics:**", "## Success")) score += 10;
        if (containsAny(body, "**Implementation", "## Implementation")) score += 10;
        if (body.length() > LONG_BODY_THRESHOLD) score += 10;

        return score;
    }

    public boolean looksGroomed(Ticket ticket) {
        return score(ticket) >= COMPLETION_THRESHOLD;
    }

    private static boolean containsAny(String body, String bold, String heading) {
        return body.contains(bold) || body.contains(heading);
    }
}
