package quest.gekko.streamstats.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.streamstats.exception.MissingConfigurationException;
import quest.gekko.streamstats.service.core.IngestionPipeline;

@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionScheduler {
    private final IngestionPipeline pipeline;

    // disabled ("-") unless INGEST_CRON is set; runs on Spring's single scheduler thread, never overlapping
    @Scheduled(cron = "${streamstats.ingest.cron:-}", zone = "UTC")
    public void runScheduledIngest() {
        try {
            var report = pipeline.run();
            log.info("Scheduled ingest finished: {} streamers, rows {}", report.rankedStreamers().size(), report.rows());
        } catch (MissingConfigurationException e) {
            log.error("Scheduled ingest skipped: {}", e.getMessage());
        }
    }
}
