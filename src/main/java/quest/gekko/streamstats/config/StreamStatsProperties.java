package quest.gekko.streamstats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the StreamsCharts source, the streamer table store and the ingest run.
 */
@Configuration
@EnableConfigurationProperties({
        StreamStatsProperties.Source.class,
        StreamStatsProperties.Store.class,
        StreamStatsProperties.Ingest.class
})
public class StreamStatsProperties {

    @ConfigurationProperties("streamstats.source")
    public record Source(String baseUrl,
                         String platform,
                         String clientId,
                         String token,
                         boolean testingMode,
                         Duration politeDelay,
                         Duration timeout,
                         int rankingLimit) {

        public boolean hasCredentials() {
            return clientId != null && !clientId.isBlank() && token != null && !token.isBlank();
        }
    }

    /** {@code periodColumnType} is the SQL type of the "date" column; TEXT on PostgreSQL. */
    @ConfigurationProperties("streamstats.store")
    public record Store(String periodColumnType) {}

    /** {@code cron} "-" disables the scheduled run; any other value keeps the process up for it. */
    @ConfigurationProperties("streamstats.ingest")
    public record Ingest(boolean runOnStartup, boolean exitAfterRun, String cron, boolean verifySample) {

        public static final String CRON_DISABLED = "-";

        public boolean scheduled() {
            return cron != null && !cron.isBlank() && !CRON_DISABLED.equals(cron.trim());
        }

        public boolean exitsAfterStartupRun() {
            return exitAfterRun && !scheduled();
        }
    }
}
