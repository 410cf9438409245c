package quest.gekko.streamstats.service.integration.connector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import quest.gekko.streamstats.config.StreamStatsProperties;
import quest.gekko.streamstats.domain.HistoryRecord;
import quest.gekko.streamstats.domain.TimeWindow;
import quest.gekko.streamstats.exception.SourceUnavailableException;
import quest.gekko.streamstats.util.RateLimiter;

import java.net.URI;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Service
@Slf4j
public class StreamsChartsConnector implements ChannelMetricsSource {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient http;
    private final String platform;
    private final boolean testingMode;
    private final Duration timeout;
    private final RateLimiter rateLimiter;

    public StreamsChartsConnector(final WebClient http, final StreamStatsProperties.Source source) {
        this.http = http;
        this.platform = source.platform() == null || source.platform().isBlank() ? "twitch" : source.platform();
        this.testingMode = source.testingMode();
        this.timeout = source.timeout() == null ? DEFAULT_TIMEOUT : source.timeout();
        this.rateLimiter = new RateLimiter(source.politeDelay());
    }

    @Override
    public String platform() { return platform; }

    @Override
    public List<String> fetchRanking(String metric, TimeWindow window, int limit) {
        log.info("Requesting {} streamers (limit: {}, sorted by {})...", platform, limit, metric);
        final Map<?, ?> body;
        try {
            body = getJson("/channels", uri -> withWindow(uri.path("/channels"), window).build());
        } catch (SourceUnavailableException e) {
            log.error("Failed to fetch streamers: {} {}", e.getStatus(), e.getBody());
            return List.of();
        }

        List<Map<String, Object>> items = safeItems(body);
        List<Map<String, Object>> named = items.stream()
                .filter(item -> channelName(item) != null)
                .toList();
        if (named.size() < items.size()) {
            log.warn("Skipped {} ranking entries without channel_name", items.size() - named.size());
        }

        // stream sort is stable, so ties keep response order
        List<String> ranking = named.stream()
                .sorted(Comparator.comparingDouble((Map<String, Object> item) -> metricValue(item.get(metric))).reversed())
                .limit(Math.max(limit, 0))
                .map(StreamsChartsConnector::channelName)
                .toList();

        log.info("Found {} streamers (top {} by {}).", ranking.size(), limit, metric);
        log.debug("Streamer list: {}", ranking);
        return ranking;
    }

    @Override
    public Optional<HistoryRecord> fetchHistory(String channelName, TimeWindow window) {
        log.debug("Requesting history for streamer: {} at period: {}", channelName, window);
        final Map<?, ?> body;
        try {
            body = getJson("/channels/" + channelName,
                    uri -> withWindow(uri.path("/channels/{name}"), window).build(channelName));
        } catch (SourceUnavailableException e) {
            log.error("Failed to fetch history for {} ({}): {} {}", channelName, window, e.getStatus(), e.getBody());
            return Optional.empty();
        }

        Object data = body.get("data");
        if (!(data instanceof Map<?, ?> stats) || stats.isEmpty()) {
            log.debug("No history data for {} ({})", channelName, window);
            return Optional.empty();
        }

        HistoryRecord record = new HistoryRecord(channelName, window.label(),
                parseInteger(stats.get("average_viewers")), parseInteger(stats.get("stream_days")));
        log.info("History record for {} ({}) added.", channelName, window);
        return Optional.of(record);
    }

    // ---- Helpers ----

    private UriBuilder withWindow(UriBuilder uri, TimeWindow window) {
        uri.queryParam("platform", platform).queryParam("time", window.label());
        if (testingMode) uri.queryParam("testing_mode", "true");
        return uri;
    }

    private Map<?, ?> getJson(String path, Function<UriBuilder, URI> uri) {
        try {
            Map<?, ?> body = rateLimiter.call(() -> http.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new SourceUnavailableException(path, resp.statusCode().value(), text)))
                    .bodyToMono(Map.class)
                    .block(timeout));
            return body == null ? Map.of() : body;
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(path, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> safeItems(Map<?, ?> obj) {
        if (obj == null) return List.of();
        Object itemsObj = obj.get("data");
        if (!(itemsObj instanceof List<?> list)) return List.of();
        return list.stream()
                .filter(Map.class::isInstance)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }

    private static String channelName(Map<String, Object> item) {
        Object name = item.get("channel_name");
        if (name == null || name.toString().isBlank()) return null;
        return name.toString();
    }

    private static double metricValue(Object o) {
        if (o instanceof Number n) return n.doubleValue();
        if (o == null) return 0d;
        try {
            return Double.parseDouble(o.toString());
        } catch (NumberFormatException e) {
            return 0d;
        }
    }

    static Integer parseInteger(Object o) {
        if (o == null) return null;
        if (o instanceof Integer i) return i;
        try {
            if (o instanceof Long || o instanceof Short || o instanceof Byte) return Math.toIntExact(((Number) o).longValue());
            double value = o instanceof Number n ? n.doubleValue() : Double.parseDouble(o.toString().trim());
            return Math.toIntExact(Math.round(value));
        } catch (NumberFormatException e) {
            return null;
        } catch (ArithmeticException e) {
            log.warn("Metric value {} is out of integer range; storing it as unknown", o);
            return null;
        }
    }
}
