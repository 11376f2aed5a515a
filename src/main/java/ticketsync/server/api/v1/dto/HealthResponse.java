package ticketsync.server.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import ticketsync.server.grooming.GroomingSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Response DTO for the health check endpoint.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("vaultPath") String vaultPath,
        @JsonProperty("tickets") Integer tickets,
        @JsonProperty("watching") Boolean watching,
        @JsonProperty("subscribers") Integer subscribers,
        @JsonProperty("grooming") GroomingInfo grooming,
        @JsonProperty("error") String error) {

    /**
     * Grooming configuration and live sessions.
     */
    public record GroomingInfo(
            @JsonProperty("autoGrooming") boolean autoGrooming,
            @JsonProperty("agentConfigured") boolean agentConfigured,
            @JsonProperty("activeSessions") List<SessionInfo> activeSessions) {
    }

    public record SessionInfo(
            @JsonProperty("ticketId") String ticketId,
            @JsonProperty("sessionKey") String sessionKey,
            @JsonProperty("startedAt") Instant startedAt) {

        public static SessionInfo from(GroomingSession session) {
            return new SessionInfo(session.ticketId(), session.sessionKey(), session.startedAt());
        }
    }

    /** Create healthy response */
    public static HealthResponse healthy(String uptime, String version, String vaultPath, int tickets,
            boolean watching, int subscribers, boolean autoGrooming, boolean agentConfigured,
            Collection<GroomingSession> sessions) {
        List<SessionInfo> active = sessions.stream()
                .map(SessionInfo::from)
                .sorted((a, b) -> a.ticketId().compareTo(b.ticketId()))
                .toList();
        return new HealthResponse("ok", uptime, version, vaultPath, tickets, watching, subscribers,
                new GroomingInfo(autoGrooming, agentConfigured, active), null);
    }

    /** Create unhealthy response */
    public static HealthResponse unhealthy(String error) {
        return new HealthResponse("error", null, null, null, null, null, null, null, error);
    }
}
