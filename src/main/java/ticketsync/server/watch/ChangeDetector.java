package ticketsync.server.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.TicketId;
import ticketsync.server.util.KeyedDebouncer;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches one flat directory for ticket files and publishes {@link FileEvent}s on a queue.
 *
 * Raw watch events only arm a per-file stabilization timer. When the timer fires and the file's
 * size and modification time have not moved since it was armed, the event kind is derived from
 * the set of files already known: new file = CREATED, known file = UPDATED, vanished known
 * file = DELETED. Files present at start are the baseline and are not reported.
 *
 * The detector never reads file contents.
 */
public class ChangeDetector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final Duration stabilityWindow;
    private final BlockingQueue<FileEvent> events = new LinkedBlockingQueue<>();
    private final Set<String> known = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;
    private Path directory;
    private WatchService watchService;
    private KeyedDebouncer<Path> stabilizer;
    private Thread watchThread;

    public ChangeDetector(Duration stabilityWindow) {
        this.stabilityWindow = stabilityWindow;
    }

    /**
     * Start watching.
     *
     * @throws WatchSetupException if the directory is missing or cannot be registered
     */
    public synchronized void start(Path dir) {
        if (running) {
            log.warn("Change detector already running on {}", directory);
            return;
        }
        if (!Files.isDirectory(dir)) {
            throw new WatchSetupException("Ticket directory does not exist: " + dir);
        }

        WatchService ws;
        try {
            ws = dir.getFileSystem().newWatchService();
        } catch (IOException e) {
            throw new WatchSetupException("Cannot create watch service for " + dir, e);
        }
        try {
            dir.register(ws, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        } catch (IOException e) {
            closeQuietly(ws);
            throw new WatchSetupException("Cannot watch " + dir, e);
        }

        this.directory = dir;
        this.watchService = ws;
        this.stabilizer = new KeyedDebouncer<>("ticket-stabilizer", stabilityWindow.toMillis());
        known.clear();
        known.addAll(scan());

        running = true;
        watchThread = new Thread(this::watchLoop, "ticket-watcher");
        watchThread.setDaemon(true);
        watchThread.start();

        log.info("Watching {} ({} existing tickets, stability window {}ms)",
                dir, known.size(), stabilityWindow.toMillis());
    }

    /**
     * Stop watching and release the watch handle. Safe to call repeatedly.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        closeQuietly(watchService);
        stabilizer.close();
        if (watchThread != null) {
            watchThread.interrupt();
            try {
                watchThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            watchThread = null;
        }
        log.info("Change detector stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isWatching() {
        return running;
    }

    /** Stream of detected events; consumers take from this queue */
    public BlockingQueue<FileEvent> events() {
        return events;
    }

    private void watchLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == OVERFLOW) {
                    log.warn("Watch events overflowed for {}; rescanning", directory);
                    emit(FileEvent.error(directory, "Watch event overflow, directory rescanned"));
                    rescan();
                    continue;
                }
                Path name = (Path) event.context();
                if (name == null || !TicketId.isTicketFile(name)) {
                    continue;
                }
                arm(directory.resolve(name));
            }

            if (!key.reset() && running) {
                log.error("Watch key for {} is no longer valid", directory);
                emit(FileEvent.error(directory, "Watch on " + directory + " was invalidated"));
                reRegister();
            }
        }
    }

    private void arm(Path file) {
        FileSnapshot snapshot = FileSnapshot.of(file);
        stabilizer.submit(file, () -> settle(file, snapshot));
    }

    private void settle(Path file, FileSnapshot armed) {
        if (!running) {
            return;
        }
        FileSnapshot current = FileSnapshot.of(file);
        if (!current.equals(armed)) {
            // still being written
            stabilizer.submit(file, () -> settle(file, current));
            return;
        }

        String name = file.getFileName().toString();
        if (current.exists()) {
            if (known.add(name)) {
                log.info("Ticket created: {}", name);
                emit(FileEvent.created(file));
            } else {
                log.info("Ticket updated: {}", name);
                emit(FileEvent.updated(file));
            }
        } else if (known.remove(name)) {
            log.info("Ticket deleted: {}", name);
            emit(FileEvent.deleted(file));
        }
    }

    private void rescan() {
        Set<String> present = scan();
        for (String name : present) {
            arm(directory.resolve(name));
        }
        for (String name : known) {
            if (!present.contains(name)) {
                arm(directory.resolve(name));
            }
        }
    }

    private void reRegister() {
        try {
            directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            rescan();
            log.info("Re-registered watch on {}", directory);
        } catch (IOException | ClosedWatchServiceException e) {
            log.error("Could not re-register watch on {}: {}", directory, e.getMessage());
            emit(FileEvent.error(directory, "Could not re-register watch: " + e.getMessage()));
        }
    }

    private Set<String> scan() {
        Set<String> names = new HashSet<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(TicketId::isTicketFile)
                    .forEach(p -> names.add(p.getFileName().toString()));
        } catch (IOException e) {
            log.warn("Could not scan {}: {}", directory, e.getMessage());
            emit(FileEvent.error(directory, "Directory scan failed: " + e.getMessage()));
        }
        return names;
    }

    private void emit(FileEvent event) {
        events.add(event);
    }

    private static void closeQuietly(WatchService ws) {
        try {
            ws.close();
        } catch (IOException e) {
            log.warn("Error closing watch service: {}", e.getMessage());
        }
    }

    private record FileSnapshot(boolean exists, long size, FileTime modified) {
        static FileSnapshot of(Path file) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                return new FileSnapshot(true, attrs.size(), attrs.lastModifiedTime());
            } catch (NoSuchFileException e) {
                return new FileSnapshot(false, -1, null);
            } catch (IOException e) {
                return new FileSnapshot(false, -1, null);
            }
        }
    }
}
