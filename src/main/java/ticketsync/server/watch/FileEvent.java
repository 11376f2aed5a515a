package ticketsync.server.watch;

import java.nio.file.Path;

/**
 * Semantic change to a ticket file, or a watch error.
 *
 * @param kind    what happened
 * @param path    the ticket file (or the watched directory for errors)
 * @param message error description, null for file events
 */
public record FileEvent(Kind kind, Path path, String message) {

    public enum Kind {
        CREATED, UPDATED, DELETED, ERROR
    }

    public static FileEvent created(Path path) {
        return new FileEvent(Kind.CREATED, path, null);
    }

    public static FileEvent updated(Path path) {
        return new FileEvent(Kind.UPDATED, path, null);
    }

    public static FileEvent deleted(Path path) {
        return new FileEvent(Kind.DELETED, path, null);
    }

    public static FileEvent error(Path path, String message) {
        return new FileEvent(Kind.ERROR, path, message);
    }
}
