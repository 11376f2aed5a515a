package ticketsync.server.agent;

/**
 * One grooming run request.
 *
 * @param ticketId          ticket being groomed
 * @param task              instructions handed to the agent
 * @param runTimeoutSeconds how long the agent may run
 */
public record AgentRequest(String ticketId, String task, int runTimeoutSeconds) {

    public static final String TOOL = "sessions_spawn";
    public static final String AGENT_ID = "grooming";
    public static final String CLEANUP = "keep";
    public static final int DEFAULT_RUN_TIMEOUT_SECONDS = 300;

    public static AgentRequest groom(String ticketId, String task) {
        return new AgentRequest(ticketId, task, DEFAULT_RUN_TIMEOUT_SECONDS);
    }

    public String label() {
        return "groom-" + ticketId;
    }
}
