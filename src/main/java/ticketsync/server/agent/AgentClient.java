package ticketsync.server.agent;

/**
 * Starts an external grooming agent run. Implementations only report whether the run was
 * accepted; the agent's own progress is observed through the ticket file.
 */
public interface AgentClient {

    /**
     * Request an agent run.
     *
     * @param request what to ask the agent to do
     * @return acknowledgement from the gateway
     * @throws AgentPreconditionException if the client is not usable (e.g. no credential);
     *                                    retrying will not help
     * @throws AgentInvocationException   if the gateway could not be reached or refused the
     *                                    request; the caller may retry
     */
    AgentAck invoke(AgentRequest request);
}
