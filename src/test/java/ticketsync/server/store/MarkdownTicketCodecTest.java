package ticketsync.server.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the markdown + front-matter ticket format.
 */
class MarkdownTicketCodecTest {

    private static final String SAMPLE = """
            ---
            id: TICK-007
            title: Add search
            status: in-progress
            priority: high
            project: Web
            assignee: dana
            estimate: 5
            createdAt: 2025-01-10T09:00:00.000Z
            updatedAt: 2025-01-11T10:30:00.000Z
            ---

            Users need to search tickets.
            """;

    private MarkdownTicketCodec codec;

    @BeforeEach
    void setUp() {
        codec = new MarkdownTicketCodec();
    }

    private Ticket parse(String text) {
        return codec.parse("TICK-007.md", text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parsesFrontMatterAndBody() {
        Ticket ticket = parse(SAMPLE);

        assertEquals("TICK-007", ticket.id());
        assertEquals("Add search", ticket.title());
        assertEquals(TicketStatus.IN_PROGRESS, ticket.status());
        assertEquals(TicketPriority.HIGH, ticket.priority());
        assertEquals("Web", ticket.project());
        assertEquals("dana", ticket.assignee());
        assertEquals(5.0, ticket.estimate());
        assertEquals(Instant.parse("2025-01-10T09:00:00Z"), ticket.createdAt());
        assertEquals(Instant.parse("2025-01-11T10:30:00Z"), ticket.updatedAt());
        assertEquals("Users need to search tickets.", ticket.body());
        assertNull(ticket.grooming());
    }

    @Test
    void toleratesBomAndWindowsLineEndings() {
        String text = "\uFEFF" + SAMPLE.replace("\n", "\r\n");

        Ticket ticket = parse(text);

        assertEquals("TICK-007", ticket.id());
        assertEquals("Users need to search tickets.", ticket.body());
    }

    @Test
    void parsesGroomingBlock() {
        String text = SAMPLE.replace("---\n\n", """
                grooming:
                  status: failed
                  attempts: 2
                  lastError: Gateway returned 500
                ---

                """);

        GroomingStatus grooming = parse(text).grooming();

        assertEquals(GroomingState.FAILED, grooming.status());
        assertEquals(2, grooming.attemptCount());
        assertEquals("Gateway returned 500", grooming.lastError());
    }

    @Test
    void missingFrontMatterIsRejected() {
        TicketParseException e = assertThrows(TicketParseException.class, () -> parse("Just a note\n"));

        assertEquals("Failed to parse ticket TICK-007.md: missing front matter", e.getMessage());
    }

    @Test
    void missingRequiredFieldIsNamed() {
        TicketParseException e = assertThrows(TicketParseException.class,
                () -> parse(SAMPLE.replace("title: Add search\n", "")));

        assertEquals("Invalid ticket metadata in TICK-007.md: title: Required", e.getMessage());
    }

    @Test
    void unknownStatusIsRejected() {
        assertThrows(TicketParseException.class, () -> parse(SAMPLE.replace("in-progress", "archived")));
    }

    @Test
    void serializedTicketParsesBackUnchanged() {
        Ticket original = Ticket.builder()
                .id("TICK-010")
                .title("Rotate keys: quarterly")
                .status(TicketStatus.TODO)
                .priority(TicketPriority.LOW)
                .project("Ops")
                .estimate(0.0)
                .createdAt(Instant.parse("2025-02-01T08:00:00.123Z"))
                .updatedAt(Instant.parse("2025-02-01T08:00:00.123Z"))
                .grooming(GroomingStatus.of(GroomingState.IN_PROGRESS).withSessionKey("groom-TICK-010-1"))
                .body("## Tasks\n- rotate\n- verify")
                .build();

        byte[] bytes = codec.serialize(original);
        Ticket parsed = codec.parse("TICK-010.md", bytes);

        String text = new String(bytes, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("---\n"));
        assertTrue(text.endsWith("\n## Tasks\n- rotate\n- verify\n"));
        assertEquals(original.title(), parsed.title());
        assertEquals(original.status(), parsed.status());
        assertEquals(original.priority(), parsed.priority());
        assertEquals(original.project(), parsed.project());
        assertEquals(original.estimate(), parsed.estimate());
        assertEquals(original.createdAt(), parsed.createdAt());
        assertEquals(original.grooming(), parsed.grooming());
        assertEquals(original.body(), parsed.body());
        assertNull(parsed.assignee());
    }
}
