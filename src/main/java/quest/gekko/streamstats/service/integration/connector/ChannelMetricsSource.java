package quest.gekko.streamstats.service.integration.connector;

import quest.gekko.streamstats.domain.HistoryRecord;
import quest.gekko.streamstats.domain.TimeWindow;

import java.util.List;
import java.util.Optional;

public interface ChannelMetricsSource {
    String platform();

    /**
     * Top {@code limit} channel names for {@code window}, highest {@code metric} first.
     * Empty when the source is unavailable.
     */
    List<String> fetchRanking(String metric, TimeWindow window, int limit);

    /** History for one channel and window; empty when the source has no data or the call failed. */
    Optional<HistoryRecord> fetchHistory(String channelName, TimeWindow window);
}
