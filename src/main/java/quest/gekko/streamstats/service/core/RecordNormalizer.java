package quest.gekko.streamstats.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.streamstats.domain.HistoryRecord;
import quest.gekko.streamstats.domain.PeriodRow;
import quest.gekko.streamstats.util.TableNames;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class RecordNormalizer {

    /**
     * Groups history into rows per streamer table, keeping input order. Streamers without history
     * still get an (empty) entry. Channel names differing only in case share a table; the later
     * streamer's rows replace the earlier one's.
     */
    public Map<String, List<PeriodRow>> normalize(Map<String, List<HistoryRecord>> historyByStreamer) {
        log.info("Formatting history data for per-streamer table insertion...");
        Map<String, List<PeriodRow>> rowsByTable = new LinkedHashMap<>();
        Map<String, String> ownerByTable = new HashMap<>();

        historyByStreamer.forEach((streamer, records) -> {
            String table = TableNames.forStreamer(streamer);
            String previousOwner = ownerByTable.put(table, streamer);
            if (previousOwner != null && !previousOwner.equals(streamer)) {
                log.warn("Streamers '{}' and '{}' share table {}; keeping rows of '{}'",
                        previousOwner, streamer, table, streamer);
            }
            List<PeriodRow> rows = records == null ? List.of() : records.stream().map(PeriodRow::of).toList();
            rowsByTable.put(table, rows);
        });

        log.debug("Formatted data for {} streamer tables: {}", rowsByTable.size(), rowsByTable);
        return rowsByTable;
    }
}
