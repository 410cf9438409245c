package quest.gekko.streamstats.domain;

import java.util.List;

public record IngestionReport(List<String> rankedStreamers, int historyRecords, int tables, AppendResult rows) {

    public static IngestionReport empty() {
        return new IngestionReport(List.of(), 0, 0, AppendResult.EMPTY);
    }
}
