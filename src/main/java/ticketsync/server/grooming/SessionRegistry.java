package ticketsync.server.grooming;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Live grooming sessions keyed by ticket id, plus a fixed set of striped locks.
 *
 * Every check-then-act on a ticket's session (eligibility, activation, reconciliation,
 * completion) runs inside {@link #withLock} for that id. An id always maps to the same stripe,
 * so the lock table does not grow with the number of tickets ever seen. Callers never hold
 * two ticket locks at once.
 */
public class SessionRegistry {

    private static final int LOCK_STRIPES = 64;

    private final Map<String, GroomingSession> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public SessionRegistry() {
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Run {@code action} while holding the lock for {@code ticketId}. Reentrant.
     */
    public <T> T withLock(String ticketId, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(ticketId.hashCode(), locks.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(String ticketId, Runnable action) {
        withLock(ticketId, () -> {
            action.run();
            return null;
        });
    }

    public boolean has(String ticketId) {
        return sessions.containsKey(ticketId);
    }

    public Optional<GroomingSession> get(String ticketId) {
        return Optional.ofNullable(sessions.get(ticketId));
    }

    /**
     * Store a session, replacing any previous one for the same ticket.
     */
    public void put(GroomingSession session) {
        sessions.put(session.ticketId(), session);
    }

    public Optional<GroomingSession> remove(String ticketId) {
        return Optional.ofNullable(sessions.remove(ticketId));
    }

    /** Read-only copy for monitoring */
    public Map<String, GroomingSession> snapshot() {
        return Map.copyOf(sessions);
    }

    public int size() {
        return sessions.size();
    }
}
