package ticketsync.server.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketId;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Markdown ticket format: a YAML front-matter block delimited by {@code ---} lines, followed by
 * the free-text body.
 *
 * <pre>
 * ---
 * id: TICK-001
 * title: Fix login
 * status: backlog
 * ...
 * ---
 *
 * Body text
 * </pre>
 */
public class MarkdownTicketCodec implements TicketCodec {

    private static final String DELIMITER = "---";

    private final YAMLMapper yaml;

    public MarkdownTicketCodec() {
        this.yaml = YAMLMapper.builder(YAMLFactory.builder()
                        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                        .build())
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Front-matter fields as they appear in the file.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FrontMatter(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("status") TicketStatus status,
            @JsonProperty("priority") TicketPriority priority,
            @JsonProperty("project") String project,
            @JsonProperty("assignee") String assignee,
            @JsonProperty("estimate") Double estimate,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("updatedAt") Instant updatedAt,
            @JsonProperty("grooming") GroomingStatus grooming) {

        void validate(String source) {
            if (!TicketId.isValid(id)) {
                throw new TicketParseException("Invalid ticket metadata in " + source + ": id: Invalid ticket ID format");
            }
            require(source, "title", title != null && !title.isBlank());
            require(source, "status", status != null);
            require(source, "priority", priority != null);
            require(source, "project", project != null);
            require(source, "createdAt", createdAt != null);
            require(source, "updatedAt", updatedAt != null);
            if (grooming != null && grooming.status() == null) {
                throw new TicketParseException("Invalid ticket metadata in " + source + ": grooming.status: Required");
            }
        }

        private static void require(String source, String field, boolean present) {
            if (!present) {
                throw new TicketParseException("Invalid ticket metadata in " + source + ": " + field + ": Required");
            }
        }
    }

    @Override
    public Ticket parse(String source, byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        text = text.replace("\r\n", "\n");

        if (!text.startsWith(DELIMITER + "\n")) {
            throw new TicketParseException("Failed to parse ticket " + source + ": missing front matter");
        }
        int close = text.indexOf("\n" + DELIMITER, DELIMITER.length());
        if (close < 0) {
            throw new TicketParseException("Failed to parse ticket " + source + ": unterminated front matter");
        }
        String header = text.substring(DELIMITER.length() + 1, close + 1);
        int bodyStart = text.indexOf('\n', close + 1);
        String body = bodyStart < 0 ? "" : text.substring(bodyStart + 1);

        FrontMatter fm;
        try {
            fm = yaml.readValue(header, FrontMatter.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TicketParseException("Failed to parse ticket " + source + ": " + e.getMessage(), e);
        }
        if (fm == null) {
            throw new TicketParseException("Failed to parse ticket " + source + ": empty front matter");
        }
        fm.validate(source);

        return Ticket.builder()
                .id(fm.id())
                .title(fm.title())
                .status(fm.status())
                .priority(fm.priority())
                .project(fm.project())
                .assignee(fm.assignee())
                .estimate(fm.estimate())
                .createdAt(fm.createdAt())
                .updatedAt(fm.updatedAt())
                .grooming(fm.grooming())
                .body(body.strip())
                .build();
    }

    @Override
    public byte[] serialize(Ticket ticket) {
        FrontMatter fm = new FrontMatter(
                ticket.id(),
                ticket.title(),
                ticket.status(),
                ticket.priority(),
                ticket.project(),
                ticket.assignee(),
                ticket.estimate(),
                ticket.createdAt(),
                ticket.updatedAt(),
                ticket.grooming());
        try {
            String header = yaml.writeValueAsString(fm);
            StringBuilder sb = new StringBuilder()
                    .append(DELIMITER).append('\n')
                    .append(header);
            if (!header.endsWith("\n")) {
                sb.append('\n');
            }
            sb.append(DELIMITER).append('\n');
            if (!ticket.body().isEmpty()) {
                sb.append('\n').append(ticket.body()).append('\n');
            }
            return sb.toString().getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ticket " + ticket.id(), e);
        }
    }
}
