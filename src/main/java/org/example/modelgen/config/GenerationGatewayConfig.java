package org.example.modelgen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.modelgen.service.gateway.GenerationGateway;
import org.example.modelgen.service.gateway.TripoGenerationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP clients for the generation service and for asset downloads.
 */
@Configuration
public class GenerationGatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationGatewayConfig.class);

    @Value("${tripo.api-url:https://api.tripo3d.ai}")
    private String tripoApiUrl;

    @Value("${tripo.api-key:}")
    private String tripoApiKey;

    @Value("${tripo.submit-timeout-seconds:60}")
    private int submitTimeoutSeconds;

    @Value("${tripo.status-timeout-seconds:30}")
    private int statusTimeoutSeconds;

    // Generated GLB files are buffered whole before being written to disk
    @Value("${generation.download.max-in-memory-mb:64}")
    private int downloadMaxInMemoryMb;

    @Bean
    public GenerationGateway generationGateway(ObjectMapper objectMapper) {
        WebClient webClient = WebClient.builder()
                .baseUrl(tripoApiUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tripoApiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("Tripo generation gateway initialized: endpoint={}, apiKeyConfigured={}",
                tripoApiUrl, tripoApiKey != null && !tripoApiKey.isBlank());
        return new TripoGenerationGateway(
                webClient,
                tripoApiKey,
                Duration.ofSeconds(Math.max(1, submitTimeoutSeconds)),
                Duration.ofSeconds(Math.max(1, statusTimeoutSeconds)),
                objectMapper
        );
    }

    @Bean
    public WebClient assetDownloadWebClient() {
        return WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(Math.max(1, downloadMaxInMemoryMb) * 1024 * 1024))
                .build();
    }
}
