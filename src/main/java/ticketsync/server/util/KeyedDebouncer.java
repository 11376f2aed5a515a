package ticketsync.server.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the most recently submitted task for a key once no newer submission for the same key has
 * arrived within the delay. Keys are independent of each other.
 */
public final class KeyedDebouncer<K> implements AutoCloseable {
    private final ScheduledExecutorService ses;
    private final long delayMs;
    private final Map<K, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public KeyedDebouncer(String threadName, long delayMs) {
        this.delayMs = delayMs;
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public void submit(K key, Runnable task) {
        pending.compute(key, (k, previous) -> {
            if (previous != null) previous.cancel(false);
            AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
            ScheduledFuture<?> future = ses.schedule(() -> {
                // a newer submission may already own the slot
                pending.remove(k, self.get());
                task.run();
            }, delayMs, TimeUnit.MILLISECONDS);
            self.set(future);
            return future;
        });
    }

    @Override public void close() {
        pending.clear();
        ses.shutdownNow();
    }
}
