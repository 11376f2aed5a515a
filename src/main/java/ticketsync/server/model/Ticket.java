package ticketsync.server.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model for one ticket file: front-matter metadata plus markdown body.
 * Use {@link #toBuilder()} to derive updated copies.
 */
public final class Ticket {
    private final String id;
    private final String title;
    private final TicketStatus status;
    private final TicketPriority priority;
    private final String project;
    private final String assignee;
    private final Double estimate;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String body;
    private final GroomingStatus grooming;

    private Ticket(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.project = Objects.requireNonNull(builder.project, "project is required");
        this.assignee = builder.assignee;
        this.estimate = builder.estimate;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.updatedAt = Objects.requireNonNull(builder.updatedAt, "updatedAt is required");
        this.body = builder.body != null ? builder.body : "";
        this.grooming = builder.grooming;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public TicketStatus status() {
        return status;
    }

    public TicketPriority priority() {
        return priority;
    }

    public String project() {
        return project;
    }

    public String assignee() {
        return assignee;
    }

    public Double estimate() {
        return estimate;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public String body() {
        return body;
    }

    public GroomingStatus grooming() {
        return grooming;
    }

    public boolean hasEstimate() {
        return estimate != null;
    }

    /** Numeric part of the id, used for id ordering */
    public int number() {
        return TicketId.number(id);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .status(status)
                .priority(priority)
                .project(project)
                .assignee(assignee)
                .estimate(estimate)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .body(body)
                .grooming(grooming);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private TicketStatus status = TicketStatus.INITIAL;
        private TicketPriority priority = TicketPriority.MEDIUM;
        private String project = "Uncategorized";
        private String assignee;
        private Double estimate;
        private Instant createdAt;
        private Instant updatedAt;
        private String body = "";
        private GroomingStatus grooming;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(TicketStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TicketPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder assignee(String assignee) {
            this.assignee = assignee;
            return this;
        }

        public Builder estimate(Double estimate) {
            this.estimate = estimate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder grooming(GroomingStatus grooming) {
            this.grooming = grooming;
            return this;
        }

        public Ticket build() {
            return new Ticket(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Ticket ticket))
            return false;
        return Objects.equals(id, ticket.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Ticket{id='" + id + "', status=" + status + ", priority=" + priority + "}";
    }
}
