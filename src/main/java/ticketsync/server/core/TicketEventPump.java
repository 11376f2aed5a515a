package ticketsync.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.grooming.GroomingOrchestrator;
import ticketsync.server.hub.BroadcastEvent;
import ticketsync.server.hub.BroadcastHub;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketId;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.repository.TicketRepository;
import ticketsync.server.store.TicketParseException;
import ticketsync.server.watch.FileEvent;

import java.util.concurrent.BlockingQueue;

/**
 * Moves file events from the change detector to the hub and the grooming orchestrator.
 *
 * For each event:
 * - CREATED: read the ticket, broadcast it, queue it for the auto-grooming check
 * - UPDATED: read the ticket, broadcast it
 * - DELETED: broadcast the id
 * - ERROR: log
 *
 * A ticket that cannot be read is logged and skipped.
 */
public class TicketEventPump implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TicketEventPump.class);

    private final BlockingQueue<FileEvent> events;
    private final TicketRepository repository;
    private final BroadcastHub hub;
    private final GroomingOrchestrator orchestrator;

    private volatile boolean running = false;
    private Thread thread;

    public TicketEventPump(BlockingQueue<FileEvent> events, TicketRepository repository, BroadcastHub hub,
            GroomingOrchestrator orchestrator) {
        this.events = events;
        this.repository = repository;
        this.hub = hub;
        this.orchestrator = orchestrator;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Event pump already running");
            return;
        }
        running = true;
        thread = new Thread(this::pumpLoop, "ticket-event-pump");
        thread.setDaemon(true);
        thread.start();
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        thread.interrupt();
        thread = null;
    }

    @Override
    public void close() {
        stop();
    }

    private void pumpLoop() {
        while (running) {
            FileEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                handle(event);
            } catch (Exception e) {
                log.error("Error handling {} for {}", event.kind(), event.path(), e);
            }
        }
    }

    void handle(FileEvent event) {
        if (event.kind() == FileEvent.Kind.ERROR) {
            log.error("Watcher error on {}: {}", event.path(), event.message());
            return;
        }

        String ticketId = TicketId.fromPath(event.path());
        if (!TicketId.isValid(ticketId)) {
            log.warn("Ignoring {} for out-of-range ticket id {}", event.kind(), ticketId);
            return;
        }
        switch (event.kind()) {
            case CREATED -> {
                Ticket ticket = read(ticketId);
                if (ticket != null) {
                    hub.publish(BroadcastEvent.ticketCreated(ticket));
                    orchestrator.onTicketCreated(ticketId);
                }
            }
            case UPDATED -> {
                Ticket ticket = read(ticketId);
                if (ticket != null) {
                    hub.publish(BroadcastEvent.ticketUpdated(ticket));
                }
            }
            case DELETED -> hub.publish(BroadcastEvent.ticketDeleted(ticketId));
            default -> log.debug("Ignoring {}", event.kind());
        }
    }

    private Ticket read(String ticketId) {
        try {
            return repository.get(ticketId);
        } catch (TicketNotFoundException e) {
            log.debug("{} vanished before it could be read", ticketId);
        } catch (TicketParseException e) {
            log.warn("Skipping unreadable ticket {}: {}", ticketId, e.getMessage());
        }
        return null;
    }
}
