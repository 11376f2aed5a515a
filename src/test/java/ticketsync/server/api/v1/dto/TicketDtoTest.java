package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import ticketsync.server.grooming.GroomingOutcome;
import ticketsync.server.grooming.GroomingSession;
import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.GroomingState;
import ticketsync.server.model.GroomingStatus;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the public API DTOs.
 */
class TicketDtoTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final Instant T0 = Instant.parse("2025-06-01T08:30:00Z");

    @Test
    void createRequestParsesWireValues() throws Exception {
        CreateTicketRequest request = MAPPER.readValue("""
                {"title": "Export", "status": "todo", "priority": "high", "estimate": 3}
                """, CreateTicketRequest.class);

        request.validate();
        CreateTicketInput input = request.toInput();

        assertEquals("Export", input.title());
        assertEquals(TicketStatus.TODO, input.status());
        assertEquals(TicketPriority.HIGH, input.priority());
        assertEquals(3.0, input.estimate());
        assertNull(input.project());
    }

    @Test
    void createRequestValidation() {
        assertThrows(IllegalArgumentException.class, () -> CreateTicketRequest.of(null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTicketRequest("t", "someday", null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateTicketRequest("t", null, "urgent", null, null, null, null).validate());
    }

    @Test
    void updateRequestCarriesGrooming() throws Exception {
        UpdateTicketRequest request = MAPPER.readValue("""
                {"status": "done", "grooming": {"status": "manual"}}
                """, UpdateTicketRequest.class);

        TicketPatch patch = request.toPatch();

        assertEquals(TicketStatus.DONE, patch.status());
        assertEquals(GroomingState.MANUAL, patch.grooming().status());
        assertNull(patch.title());
    }

    @Test
    void ticketResponseOmitsAbsentFields() throws Exception {
        Ticket ticket = Ticket.builder()
                .id("TICK-001")
                .title("Fix login")
                .createdAt(T0)
                .updatedAt(T0)
                .grooming(GroomingStatus.of(GroomingState.PENDING).withAttempts(1))
                .build();

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(TicketResponse.from(ticket)));

        assertEquals("TICK-001", json.get("id").asText());
        assertEquals("backlog", json.get("status").asText());
        assertEquals("medium", json.get("priority").asText());
        assertEquals("2025-06-01T08:30:00Z", json.get("createdAt").asText());
        assertEquals("pending", json.get("grooming").get("status").asText());
        assertEquals(1, json.get("grooming").get("attempts").asInt());
        assertFalse(json.has("assignee"));
        assertFalse(json.has("estimate"));
        assertFalse(json.get("grooming").has("inFlight"));
    }

    @Test
    void listResponseCountsTickets() {
        Ticket ticket = Ticket.builder().id("TICK-001").title("t").createdAt(T0).updatedAt(T0).build();

        TicketListResponse response = TicketListResponse.from(List.of(ticket));

        assertEquals(1, response.count());
        assertEquals("TICK-001", response.tickets().get(0).id());
    }

    @Test
    void triggerResponseMirrorsOutcome() {
        GroomingTriggerResponse ok = GroomingTriggerResponse.from(GroomingOutcome.triggered("groom-TICK-001-1"));
        GroomingTriggerResponse rejected = GroomingTriggerResponse.from(
                GroomingOutcome.rejected("Grooming already in progress"));

        assertTrue(ok.success());
        assertEquals("groom-TICK-001-1", ok.sessionKey());
        assertFalse(rejected.success());
        assertEquals("Grooming already in progress", rejected.error());
    }

    @Test
    void healthListsSessionsInIdOrder() {
        HealthResponse health = HealthResponse.healthy("5s", "1.0.0", "/tickets", 2, true, 1, true, false,
                List.of(new GroomingSession("TICK-002", "b", T0), new GroomingSession("TICK-001", "a", T0)));

        assertEquals("ok", health.status());
        assertEquals(List.of("TICK-001", "TICK-002"),
                health.grooming().activeSessions().stream().map(HealthResponse.SessionInfo::ticketId).toList());
        assertEquals("error", HealthResponse.unhealthy("disk gone").status());
    }
}
