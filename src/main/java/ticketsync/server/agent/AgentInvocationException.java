package ticketsync.server.agent;

/**
 * Transport or gateway failure while starting an agent run. Retryable.
 */
public class AgentInvocationException extends RuntimeException {

    public AgentInvocationException(String message) {
        super(message);
    }

    public AgentInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
