package ticketsync.server.agent;

/**
 * The agent client cannot make a request at all (missing credential). Not retryable.
 */
public class AgentPreconditionException extends RuntimeException {

    public AgentPreconditionException(String message) {
        super(message);
    }
}
