package ticketsync.server.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ticket identifier and file-name conventions: {@code TICK-001}, stored as {@code TICK-001.md}.
 */
public final class TicketId {

    public static final String PREFIX = "TICK-";
    public static final String EXTENSION = ".md";

    private static final Pattern ID_PATTERN = Pattern.compile("^TICK-(\\d+)$");
    private static final Pattern FILE_PATTERN = Pattern.compile("^TICK-(\\d+)\\.md$");
    private static final Pattern EMBEDDED_ID = Pattern.compile("TICK-\\d+");

    private TicketId() {
    }

    /** Well-formed and with a numeric suffix that fits an {@code int} */
    public static boolean isValid(String id) {
        if (id == null) {
            return false;
        }
        Matcher m = ID_PATTERN.matcher(id);
        return m.matches() && parseSuffix(m.group(1)) >= 0;
    }

    /** True if the bare file name is a ticket file */
    public static boolean isTicketFile(String fileName) {
        return fileName != null && FILE_PATTERN.matcher(fileName).matches();
    }

    public static boolean isTicketFile(Path path) {
        Path name = path.getFileName();
        return name != null && isTicketFile(name.toString());
    }

    public static String fileName(String id) {
        return id + EXTENSION;
    }

    /** Extract the ticket id from a file path */
    public static String fromPath(Path path) {
        Matcher m = EMBEDDED_ID.matcher(String.valueOf(path.getFileName()));
        if (!m.find()) {
            throw new IllegalArgumentException("Could not extract ticket id from path: " + path);
        }
        return m.group();
    }

    public static int number(String id) {
        Matcher m = ID_PATTERN.matcher(id);
        int number = m.matches() ? parseSuffix(m.group(1)) : -1;
        if (number < 0) {
            throw new IllegalArgumentException("Invalid ticket id: " + id);
        }
        return number;
    }

    /** Zero-padded to at least three digits */
    public static String format(int number) {
        return PREFIX + String.format("%03d", number);
    }

    /** Next id after the highest numeric suffix among {@code existingIds}; ignores malformed ids */
    public static String next(Collection<String> existingIds) {
        int max = 0;
        for (String id : existingIds) {
            if (isValid(id)) {
                max = Math.max(max, number(id));
            }
        }
        if (max == Integer.MAX_VALUE) {
            throw new IllegalStateException("Ticket numbers exhausted");
        }
        return format(max + 1);
    }

    /** -1 when the digits overflow an int */
    private static int parseSuffix(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
