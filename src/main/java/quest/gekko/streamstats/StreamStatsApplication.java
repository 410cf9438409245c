package quest.gekko.streamstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;
import quest.gekko.streamstats.config.StreamStatsProperties;

@SpringBootApplication
@EnableScheduling
public class StreamStatsApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(StreamStatsApplication.class, args);
        if (context.getBean(StreamStatsProperties.Ingest.class).exitsAfterStartupRun()) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
