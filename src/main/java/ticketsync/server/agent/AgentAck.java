package ticketsync.server.agent;

/**
 * Gateway acknowledgement. {@code childSessionKey} may be null when the gateway does not
 * report one.
 */
public record AgentAck(String childSessionKey) {
}
