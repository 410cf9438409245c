package quest.gekko.streamstats.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import quest.gekko.streamstats.config.StreamStatsProperties;
import quest.gekko.streamstats.domain.IngestionReport;
import quest.gekko.streamstats.exception.MissingConfigurationException;
import quest.gekko.streamstats.service.core.IngestionPipeline;

/** Runs one ingest at startup; the exit code reports missing configuration. */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionRunner implements ApplicationRunner, ExitCodeGenerator {
    private final IngestionPipeline pipeline;
    private final StreamStatsProperties.Ingest ingestProperties;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        if (!ingestProperties.runOnStartup()) return;
        try {
            IngestionReport report = pipeline.run();
            log.info("Ingest finished: {} streamers, {} history records, {} tables, rows {}",
                    report.rankedStreamers().size(), report.historyRecords(), report.tables(), report.rows());
        } catch (MissingConfigurationException e) {
            log.error("{}. Exiting.", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
