package quest.gekko.streamstats.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.streamstats.config.StreamStatsProperties;
import quest.gekko.streamstats.domain.AppendResult;
import quest.gekko.streamstats.domain.HistoryRecord;
import quest.gekko.streamstats.domain.IngestionReport;
import quest.gekko.streamstats.domain.PeriodRow;
import quest.gekko.streamstats.domain.TimeWindow;
import quest.gekko.streamstats.exception.MissingConfigurationException;
import quest.gekko.streamstats.repository.StreamerTableStore;
import quest.gekko.streamstats.service.integration.connector.ChannelMetricsSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Ranking, then history per streamer and window, then schema, then rows. Sequential; the only
 * early exit is an empty ranking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionPipeline {
    static final String RANKING_METRIC = "average_viewers";
    static final int DEFAULT_RANKING_LIMIT = 20;

    private final ChannelMetricsSource source;
    private final RecordNormalizer normalizer;
    private final StreamerTableStore store;
    private final StreamStatsProperties.Source sourceProperties;
    private final StreamStatsProperties.Ingest ingestProperties;

    public IngestionReport run() {
        if (!sourceProperties.hasCredentials()) {
            throw new MissingConfigurationException("CLIENT_ID or TOKEN not found in environment");
        }

        int limit = sourceProperties.rankingLimit() > 0 ? sourceProperties.rankingLimit() : DEFAULT_RANKING_LIMIT;
        List<String> ranking = source.fetchRanking(RANKING_METRIC, TimeWindow.SEVEN_DAYS, limit);
        if (ranking.isEmpty()) {
            log.warn("No streamers ranked for {}; nothing to ingest.", source.platform());
            return IngestionReport.empty();
        }

        Map<String, List<HistoryRecord>> history = fetchHistory(ranking);
        store.ensureSchema(ranking);
        Map<String, List<PeriodRow>> rowsByTable = normalizer.normalize(history);

        log.info("Appending data to {} streamer tables...", rowsByTable.size());
        AppendResult total = AppendResult.EMPTY;
        for (Map.Entry<String, List<PeriodRow>> entry : rowsByTable.entrySet()) {
            total = total.plus(store.appendRecords(entry.getKey(), entry.getValue()));
        }
        log.info("All data appended to streamer tables: {} inserted, {} already present, {} failed.",
                total.inserted(), total.skipped(), total.failed());

        if (ingestProperties.verifySample()) {
            verifySample(rowsByTable);
        }

        int records = history.values().stream().mapToInt(List::size).sum();
        return new IngestionReport(ranking, records, rowsByTable.size(), total);
    }

    private Map<String, List<HistoryRecord>> fetchHistory(List<String> ranking) {
        log.info("Fetching history for each streamer at multiple time points...");
        Map<String, List<HistoryRecord>> history = new LinkedHashMap<>();
        for (String streamer : ranking) {
            List<HistoryRecord> records = new ArrayList<>();
            for (TimeWindow window : TimeWindow.HISTORY_WINDOWS) {
                source.fetchHistory(streamer, window).ifPresent(records::add);
            }
            history.put(streamer, records);
        }
        return history;
    }

    /** Reads back one randomly chosen row of this run; its period must now be stored. */
    boolean verifySample(Map<String, List<PeriodRow>> rowsByTable) {
        List<Map.Entry<String, PeriodRow>> candidates = new ArrayList<>();
        rowsByTable.forEach((table, rows) -> rows.forEach(row -> candidates.add(Map.entry(table, row))));
        if (candidates.isEmpty()) {
            log.info("No rows to verify.");
            return true;
        }

        Map.Entry<String, PeriodRow> sample = candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
        log.info("Validating presence of data line in database: {} {}", sample.getKey(), sample.getValue());
        boolean found;
        try {
            found = store.findRecords(sample.getKey()).stream()
                    .anyMatch(stored -> stored.periodLabel().equals(sample.getValue().periodLabel()));
        } catch (DataAccessException e) {
            log.warn("Sample check could not read {}: {}", sample.getKey(), e.getMessage());
            return false;
        }
        if (found) {
            log.info("Sample check passed: data line found.");
        } else {
            log.warn("Sample check failed: {} has no row for {}", sample.getKey(), sample.getValue().periodLabel());
        }
        return found;
    }
}
