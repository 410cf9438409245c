package quest.gekko.streamstats.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamStatsPropertiesTest {

    @Test
    void disabledCronExitsAfterStartupRun() {
        assertThat(new StreamStatsProperties.Ingest(true, true, "-", false).exitsAfterStartupRun()).isTrue();
        assertThat(new StreamStatsProperties.Ingest(true, true, null, false).exitsAfterStartupRun()).isTrue();
        assertThat(new StreamStatsProperties.Ingest(true, true, " ", false).exitsAfterStartupRun()).isTrue();
    }

    @Test
    void configuredCronStaysUpEvenWhenExitAfterRunIsSet() {
        var ingest = new StreamStatsProperties.Ingest(true, true, "0 0 3 * * *", false);

        assertThat(ingest.scheduled()).isTrue();
        assertThat(ingest.exitsAfterStartupRun()).isFalse();
    }

    @Test
    void exitAfterRunFalseStaysUpWithoutCron() {
        assertThat(new StreamStatsProperties.Ingest(true, false, "-", false).exitsAfterStartupRun()).isFalse();
    }
}
