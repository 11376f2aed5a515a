package ticketsync.server.watch;

/**
 * The ticket directory could not be watched. Raised from {@link ChangeDetector#start}; not retried.
 */
public class WatchSetupException extends RuntimeException {

    public WatchSetupException(String message) {
        super(message);
    }

    public WatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
