package quest.gekko.streamstats.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    // ranking pages for a whole platform are larger than the 256k default
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    @Bean
    public WebClient streamsChartsWebClient(final WebClient.Builder builder, final StreamStatsProperties.Source source) {
        return builder
                .baseUrl(source.baseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> {
                    if (source.clientId() != null && !source.clientId().isBlank()) headers.set("Client-ID", source.clientId());
                    if (source.token() != null && !source.token().isBlank()) headers.set("Token", source.token());
                })
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
