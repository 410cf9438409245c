package quest.gekko.streamstats.domain;

import java.util.List;

/** Time windows understood by the StreamsCharts {@code time} query parameter. */
public enum TimeWindow {
    SEVEN_DAYS("7-days"),
    LAST_MONTH("last-month"),
    LAST_YEAR("last-year");

    /** Windows fetched for every ranked streamer, in insertion order. */
    public static final List<TimeWindow> HISTORY_WINDOWS = List.of(SEVEN_DAYS, LAST_MONTH, LAST_YEAR);

    private final String label;

    TimeWindow(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
