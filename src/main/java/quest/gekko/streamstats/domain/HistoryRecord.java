package quest.gekko.streamstats.domain;

/**
 * One viewership snapshot for a streamer. {@code periodLabel} is the window label ("7-days", ...)
 * and doubles as the row key. Metrics are null when the API did not report them.
 */
public record HistoryRecord(String entityKey, String periodLabel, Integer averageViewers, Integer activeDays) {}
