package ticketsync.server.hub;

/**
 * A connected client of the broadcast hub.
 */
public interface Subscriber {

    /** Stable id, unique per connection */
    String id();

    /**
     * Deliver one serialized event. May throw if the connection is gone; the hub logs and
     * moves on.
     */
    void send(String message);

    /** False once the underlying connection has closed */
    default boolean isOpen() {
        return true;
    }
}
