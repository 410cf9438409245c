package quest.gekko.streamstats.domain;

/** Outcome of appending a batch of rows to one streamer table. */
public record AppendResult(int inserted, int skipped, int failed) {

    public static final AppendResult EMPTY = new AppendResult(0, 0, 0);

    public AppendResult plus(AppendResult other) {
        return new AppendResult(inserted + other.inserted, skipped + other.skipped, failed + other.failed);
    }
}
