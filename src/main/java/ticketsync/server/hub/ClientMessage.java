package ticketsync.server.hub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound message from a broadcast client: {@code {"type":"ticket:subscribe","ticketId":"TICK-001"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMessage(
        @JsonProperty("type") String type,
        @JsonProperty("ticketId") String ticketId) {

    public static final String SUBSCRIBE = "ticket:subscribe";
    public static final String UNSUBSCRIBE = "ticket:unsubscribe";

    public static ClientMessage subscribe(String ticketId) {
        return new ClientMessage(SUBSCRIBE, ticketId);
    }

    public static ClientMessage unsubscribe(String ticketId) {
        return new ClientMessage(UNSUBSCRIBE, ticketId);
    }

    /**
     * Apply this message to the hub on behalf of {@code subscriberId}.
     *
     * @return false if the message type is not recognized or carries no ticket id
     */
    public boolean applyTo(BroadcastHub hub, String subscriberId) {
        if (ticketId == null || ticketId.isBlank()) {
            return false;
        }
        if (SUBSCRIBE.equals(type)) {
            hub.subscribe(subscriberId, ticketId);
            return true;
        }
        if (UNSUBSCRIBE.equals(type)) {
            hub.unsubscribe(subscriberId, ticketId);
            return true;
        }
        return false;
    }
}
