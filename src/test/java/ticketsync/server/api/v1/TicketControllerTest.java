package ticketsync.server.api.v1;

import org.junit.jupiter.api.Test;
import ticketsync.server.model.TicketPriority;
import ticketsync.server.model.TicketStatus;
import ticketsync.server.repository.TicketQuery;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for list query parameter parsing.
 */
class TicketControllerTest {

    @Test
    void emptyParametersMeanAll() {
        assertEquals(TicketQuery.all(), TicketController.parseQuery(Map.of()));
    }

    @Test
    void parsesFiltersAndSort() {
        TicketQuery query = TicketController.parseQuery(Map.of(
                "status", List.of("in-progress"),
                "priority", List.of("high"),
                "project", List.of("Web"),
                "assignee", List.of("dana"),
                "sort", List.of("updatedAt"),
                "order", List.of("desc")));

        assertEquals(TicketStatus.IN_PROGRESS, query.status());
        assertEquals(TicketPriority.HIGH, query.priority());
        assertEquals("Web", query.project());
        assertEquals("dana", query.assignee());
        assertEquals(TicketQuery.SortField.UPDATED_AT, query.sort());
        assertEquals(TicketQuery.SortOrder.DESC, query.order());
    }

    @Test
    void orderAloneKeepsIdSort() {
        TicketQuery query = TicketController.parseQuery(Map.of("order", List.of("DESC")));

        assertEquals(TicketQuery.SortField.ID, query.sort());
        assertEquals(TicketQuery.SortOrder.DESC, query.order());
    }

    @Test
    void blankValuesAreIgnored() {
        assertNull(TicketController.parseQuery(Map.of("status", List.of(""))).status());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TicketController.parseQuery(Map.of("status", List.of("archived"))));
        assertThrows(IllegalArgumentException.class,
                () -> TicketController.parseQuery(Map.of("sort", List.of("title"))));
    }
}
