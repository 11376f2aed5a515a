package ticketsync.server.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.model.CreateTicketInput;
import ticketsync.server.model.Ticket;
import ticketsync.server.model.TicketId;
import ticketsync.server.model.TicketPatch;
import ticketsync.server.repository.TicketNotFoundException;
import ticketsync.server.repository.TicketQuery;
import ticketsync.server.repository.TicketRepository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ticket repository backed by one markdown file per ticket in a single flat directory.
 *
 * Writes go through a temp file and an atomic rename so readers (and the change detector)
 * never observe a half-written ticket. Creation is serialized within this process; a
 * concurrent writer in another process can still race the id computation.
 */
public class FileTicketRepository implements TicketRepository {

    private static final Logger log = LoggerFactory.getLogger(FileTicketRepository.class);

    private final Path directory;
    private final TicketCodec codec;
    private final Clock clock;

    public FileTicketRepository(Path directory, TicketCodec codec, Clock clock) {
        this.directory = directory;
        this.codec = codec;
        this.clock = clock;
    }

    public FileTicketRepository(Path directory) {
        this(directory, new MarkdownTicketCodec(), Clock.systemUTC());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public List<Ticket> list(TicketQuery query) {
        List<Ticket> tickets = new ArrayList<>();
        for (Path file : ticketFiles()) {
            try {
                tickets.add(codec.parse(file.getFileName().toString(), Files.readAllBytes(file)));
            } catch (TicketParseException e) {
                log.warn("Skipping unparseable ticket {}: {}", file.getFileName(), e.getMessage());
            } catch (NoSuchFileException e) {
                log.debug("Ticket {} disappeared while listing", file.getFileName());
            } catch (IOException e) {
                log.warn("Skipping unreadable ticket {}: {}", file.getFileName(), e.getMessage());
            }
        }

        // directory order is filesystem dependent; ties in the requested sort fall back to id order
        tickets.sort(Comparator.comparingInt(Ticket::number));

        TicketQuery q = query != null ? query : TicketQuery.all();
        List<Ticket> filtered = new ArrayList<>(tickets.stream().filter(q.filter()).toList());
        filtered.sort(q.comparator());
        return filtered;
    }

    @Override
    public Ticket get(String id) {
        Path file = fileFor(id);
        try {
            return codec.parse(file.getFileName().toString(), Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            throw new TicketNotFoundException(id);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ticket " + id, e);
        }
    }

    @Override
    public synchronized Ticket create(CreateTicketInput input) {
        input.validate();

        String id = nextId();
        Instant now = now();

        Ticket ticket = Ticket.builder()
                .id(id)
                .title(input.title())
                .status(input.statusOrDefault())
                .priority(input.priorityOrDefault())
                .project(input.projectOrDefault())
                .assignee(input.assignee())
                .estimate(input.estimate())
                .createdAt(now)
                .updatedAt(now)
                .body(input.bodyOrDefault())
                .build();

        write(ticket);
        log.info("Created ticket {}", id);
        return ticket;
    }

    @Override
    public Ticket update(String id, TicketPatch patch) {
        patch.validate();
        Ticket existing = get(id);

        Ticket updated = patch.applyTo(existing)
                .id(existing.id())
                .createdAt(existing.createdAt())
                .updatedAt(nextModified(existing.updatedAt()))
                .build();

        write(updated);
        log.debug("Updated ticket {}", id);
        return updated;
    }

    @Override
    public void delete(String id) {
        Path file = fileFor(id);
        try {
            Files.delete(file);
            log.info("Deleted ticket {}", id);
        } catch (NoSuchFileException e) {
            throw new TicketNotFoundException(id);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete ticket " + id, e);
        }
    }

    @Override
    public int count() {
        return ticketFiles().size();
    }

    private List<Path> ticketFiles() {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(TicketId::isTicketFile)
                    .filter(Files::isRegularFile)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Ticket directory not accessible: " + directory, e);
        }
    }

    private String nextId() {
        List<String> existing = ticketFiles().stream()
                .map(TicketId::fromPath)
                .toList();
        return TicketId.next(existing);
    }

    private Path fileFor(String id) {
        if (!TicketId.isValid(id)) {
            throw new IllegalArgumentException("Invalid ticket id: " + id);
        }
        return directory.resolve(TicketId.fileName(id));
    }

    private void write(Ticket ticket) {
        Path target = fileFor(ticket.id());
        byte[] content = codec.serialize(ticket);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, ".ticket-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ticket " + ticket.id(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /** Modification time strictly after {@code previous}, even if the clock has not moved */
    private Instant nextModified(Instant previous) {
        Instant now = now();
        return now.isAfter(previous) ? now : previous.plusMillis(1);
    }
}
