package quest.gekko.streamstats.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives and quotes streamer table identifiers. Channel names come from the analytics API, so they
 * are never spliced into SQL unquoted.
 */
public final class TableNames {
    public static final String PREFIX = "streamer_";

    private static final Pattern COLUMN_TYPE = Pattern.compile("[A-Za-z]+( ?\\(\\d+\\))?");

    private TableNames() {}

    /** {@code "Foo"} and {@code "foo"} both map to {@code streamer_foo}. */
    public static String forStreamer(String channelName) {
        if (channelName == null || channelName.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
        return PREFIX + channelName.toLowerCase(Locale.ROOT);
    }

    /** Double-quoted SQL identifier with embedded quotes doubled. */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Identifier must not contain NUL: " + identifier.replace('\0', '?'));
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    public static String requireColumnType(String type) {
        if (type == null || !COLUMN_TYPE.matcher(type.trim()).matches()) {
            throw new IllegalArgumentException("Unsupported period column type: " + type);
        }
        return type.trim();
    }
}
