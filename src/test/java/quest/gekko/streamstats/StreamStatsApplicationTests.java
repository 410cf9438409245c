package quest.gekko.streamstats;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import quest.gekko.streamstats.config.StreamStatsProperties;
import quest.gekko.streamstats.service.core.IngestionPipeline;
import quest.gekko.streamstats.service.integration.connector.ChannelMetricsSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:context;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "streamstats.ingest.run-on-startup=false",
        "streamstats.store.period-column-type=VARCHAR(64)"
})
class StreamStatsApplicationTests {

    @Autowired
    private StreamStatsProperties.Source source;
    @Autowired
    private StreamStatsProperties.Ingest ingest;
    @Autowired
    private ChannelMetricsSource metricsSource;
    @Autowired
    private IngestionPipeline pipeline;

    @Test
    void contextLoadsWithDefaults() {
        assertThat(pipeline).isNotNull();
        assertThat(metricsSource.platform()).isEqualTo("twitch");
        assertThat(source.baseUrl()).isEqualTo("https://streamscharts.com/api/jazz");
        assertThat(source.politeDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(source.rankingLimit()).isEqualTo(20);
        assertThat(ingest.scheduled()).isFalse();
        assertThat(ingest.exitsAfterStartupRun()).isTrue();
    }
}
