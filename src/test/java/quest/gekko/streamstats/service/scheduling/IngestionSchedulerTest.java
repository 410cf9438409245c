package quest.gekko.streamstats.service.scheduling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.streamstats.domain.IngestionReport;
import quest.gekko.streamstats.exception.MissingConfigurationException;
import quest.gekko.streamstats.service.core.IngestionPipeline;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionSchedulerTest {

    @Mock
    private IngestionPipeline pipeline;

    @Test
    void missingConfigurationSkipsTheTickWithoutThrowing() {
        when(pipeline.run())
                .thenThrow(new MissingConfigurationException("CLIENT_ID or TOKEN not found in environment"))
                .thenReturn(IngestionReport.empty());
        var scheduler = new IngestionScheduler(pipeline);

        assertThatCode(scheduler::runScheduledIngest).doesNotThrowAnyException();
        assertThatCode(scheduler::runScheduledIngest).doesNotThrowAnyException();
        verify(pipeline, times(2)).run();
    }
}
