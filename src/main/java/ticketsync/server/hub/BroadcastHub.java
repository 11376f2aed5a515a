package ticketsync.server.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.Ticket;
import ticketsync.server.repository.TicketQuery;
import ticketsync.server.repository.TicketRepository;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Fans ticket change events out to connected subscribers.
 *
 * All deliveries (snapshots on connect and published events) go through one queue drained by a
 * single delivery thread, so each subscriber sees messages in publish order. A new subscriber
 * receives nothing until its snapshot goes out; events queued before that are already in it.
 *
 * Delivery is fire-and-forget:
 * - a subscriber whose send fails is logged and skipped
 * - a closed subscriber is dropped
 * - nothing is buffered for subscribers that connect later
 */
public class BroadcastHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    static final String LOAD_FAILED = "Failed to load tickets";

    private final TicketRepository repository;
    private final ObjectMapper mapper;
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
    private final Set<String> awaitingSnapshot = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<Runnable> deliveries = new LinkedBlockingQueue<>();

    private volatile boolean running = false;
    private Thread deliveryThread;

    public BroadcastHub(TicketRepository repository, ObjectMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Broadcast hub already running");
            return;
        }
        running = true;
        deliveryThread = new Thread(this::deliveryLoop, "broadcast-hub");
        deliveryThread.setDaemon(true);
        deliveryThread.start();
        log.info("Broadcast hub started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        deliveryThread.interrupt();
        deliveryThread = null;
        deliveries.clear();
        log.info("Broadcast hub stopped ({} subscribers dropped)", subscribers.size());
        subscribers.clear();
        rooms.clear();
        awaitingSnapshot.clear();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Register a subscriber and queue its initial {@code tickets:init} snapshot.
     */
    public void connect(Subscriber subscriber) {
        awaitingSnapshot.add(subscriber.id());
        subscribers.put(subscriber.id(), subscriber);
        log.debug("Subscriber {} connected", subscriber.id());
        deliveries.add(() -> sendSnapshot(subscriber));
    }

    /**
     * Remove a subscriber from the hub and from every ticket group.
     */
    public void disconnect(String subscriberId) {
        if (subscribers.remove(subscriberId) != null) {
            log.debug("Subscriber {} disconnected", subscriberId);
        }
        awaitingSnapshot.remove(subscriberId);
        rooms.values().forEach(members -> members.remove(subscriberId));
        rooms.values().removeIf(Set::isEmpty);
    }

    /**
     * Add a subscriber to a ticket's group. Unknown subscribers are ignored.
     */
    public void subscribe(String subscriberId, String ticketId) {
        if (!subscribers.containsKey(subscriberId)) {
            log.debug("Ignoring subscribe from unknown subscriber {}", subscriberId);
            return;
        }
        rooms.computeIfAbsent(ticketId, k -> ConcurrentHashMap.newKeySet()).add(subscriberId);
        log.debug("Subscriber {} joined {}", subscriberId, ticketId);
    }

    public void unsubscribe(String subscriberId, String ticketId) {
        rooms.computeIfPresent(ticketId, (k, members) -> {
            members.remove(subscriberId);
            return members.isEmpty() ? null : members;
        });
        log.debug("Subscriber {} left {}", subscriberId, ticketId);
    }

    /**
     * Queue an event for delivery. Returns immediately.
     */
    public void publish(BroadcastEvent event) {
        if (!running) {
            log.debug("Hub not running, dropping {}", event.type());
            return;
        }
        deliveries.add(() -> fanOut(event));
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public Set<String> groupMembers(String ticketId) {
        Set<String> members = rooms.get(ticketId);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    private void deliveryLoop() {
        while (running) {
            Runnable delivery;
            try {
                delivery = deliveries.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                delivery.run();
            } catch (Exception e) {
                log.error("Broadcast delivery error", e);
            }
        }
    }

    private void sendSnapshot(Subscriber subscriber) {
        awaitingSnapshot.remove(subscriber.id());
        BroadcastEvent snapshot;
        try {
            List<Ticket> tickets = repository.list(TicketQuery.all());
            snapshot = BroadcastEvent.ticketsInit(tickets);
        } catch (RuntimeException e) {
            log.error("Could not load tickets for subscriber {}: {}", subscriber.id(), e.getMessage());
            snapshot = BroadcastEvent.error(LOAD_FAILED);
        }
        String message = serialize(snapshot);
        if (message != null) {
            deliver(subscriber, message);
        }
    }

    private void fanOut(BroadcastEvent event) {
        String message = serialize(event);
        if (message == null) {
            return;
        }

        for (Subscriber subscriber : subscribers.values()) {
            if (!awaitingSnapshot.contains(subscriber.id())) {
                deliver(subscriber, message);
            }
        }

        // group members get updates a second time
        if (BroadcastEvent.TICKET_UPDATED.equals(event.type()) && event.ticketId() != null) {
            for (String memberId : groupMembers(event.ticketId())) {
                Subscriber member = subscribers.get(memberId);
                if (member != null && !awaitingSnapshot.contains(memberId)) {
                    deliver(member, message);
                }
            }
        }

        log.debug("Broadcast {} to {} subscribers", event.type(), subscribers.size());
    }

    private void deliver(Subscriber subscriber, String message) {
        if (!subscriber.isOpen()) {
            disconnect(subscriber.id());
            return;
        }
        try {
            subscriber.send(message);
        } catch (RuntimeException e) {
            log.warn("Delivery to subscriber {} failed: {}", subscriber.id(), e.getMessage());
        }
    }

    private String serialize(BroadcastEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} event", event.type(), e);
            return null;
        }
    }
}
