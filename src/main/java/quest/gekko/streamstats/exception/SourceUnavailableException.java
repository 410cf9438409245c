package quest.gekko.streamstats.exception;

import lombok.Getter;

/**
 * The analytics API answered with a non-success status, or could not be reached at all
 * (in which case {@link #getStatus()} is -1).
 */
@Getter
public class SourceUnavailableException extends RuntimeException {
    private final String path;
    private final int status;
    private final String body;

    public SourceUnavailableException(String path, int status, String body) {
        super("GET " + path + " -> " + status + " " + body);
        this.path = path;
        this.status = status;
        this.body = body;
    }

    public SourceUnavailableException(String path, Throwable cause) {
        super("GET " + path + " failed: " + cause.getMessage(), cause);
        this.path = path;
        this.status = -1;
        this.body = "";
    }
}
