package quest.gekko.streamstats;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import quest.gekko.streamstats.config.StreamStatsProperties;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:scheduled;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "streamstats.ingest.run-on-startup=false",
        "streamstats.store.period-column-type=VARCHAR(64)",
        "INGEST_CRON=0 0 3 * * *"
})
class ScheduledModeApplicationTests {

    @Autowired
    private StreamStatsProperties.Ingest ingest;

    @Test
    void configuredCronKeepsTheProcessUp() {
        assertThat(ingest.cron()).isEqualTo("0 0 3 * * *");
        assertThat(ingest.scheduled()).isTrue();
        assertThat(ingest.exitsAfterStartupRun()).isFalse();
    }
}
