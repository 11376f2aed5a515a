package ticketsync.server.grooming;

/**
 * Result of one grooming trigger.
 *
 * @param result     what happened
 * @param sessionKey session key when triggered
 * @param error      reason when skipped, rejected or failed
 */
public record GroomingOutcome(Result result, String sessionKey, String error) {

    public enum Result {
        /** Gateway accepted the run; a session is live */
        TRIGGERED,
        /** Ticket did not qualify for automatic grooming */
        SKIPPED,
        /** A grooming run is already pending or in progress */
        REJECTED,
        /** Every invocation attempt failed */
        FAILED
    }

    public static GroomingOutcome triggered(String sessionKey) {
        return new GroomingOutcome(Result.TRIGGERED, sessionKey, null);
    }

    public static GroomingOutcome skipped(String reason) {
        return new GroomingOutcome(Result.SKIPPED, null, reason);
    }

    public static GroomingOutcome rejected(String reason) {
        return new GroomingOutcome(Result.REJECTED, null, reason);
    }

    public static GroomingOutcome failed(String error) {
        return new GroomingOutcome(Result.FAILED, null, error);
    }

    public boolean success() {
        return result == Result.TRIGGERED;
    }
}
