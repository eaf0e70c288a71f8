package com.dataPlatform.platformFacade.config;

import com.dataPlatform.platformFacade.facade.cache.ResponseCache;
import com.dataPlatform.platformFacade.platform.KagglePlatformClient;
import com.dataPlatform.platformFacade.platform.PlatformClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the facade: settings from application.yaml, the shared response cache and
 * the platform client.
 */
@Slf4j
@Configuration
public class FacadeConfig {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Bean
    public FacadeSettings facadeSettings(
            @Value("${platform.api.base-url:https://www.kaggle.com/api/v1}") String apiBaseUrl,
            @Value("${platform.site-url:https://www.kaggle.com}") String siteUrl,
            @Value("${platform.api.username:}") String username,
            @Value("${platform.api.key:}") String apiKey,
            @Value("${platform.api.connect-timeout:10s}") Duration connectTimeout,
            @Value("${platform.api.read-timeout:60s}") Duration readTimeout,
            @Value("${platform.download.default-path:./kaggle_data}") String defaultDownloadPath,
            @Value("${platform.pagination.default-page-size:20}") int defaultPageSize,
            @Value("${platform.pagination.max-page-size:100}") int maxPageSize,
            @Value("${platform.cache.ttl.competitions:3600s}") Duration competitionsTtl,
            @Value("${platform.cache.ttl.datasets:21600s}") Duration datasetsTtl,
            @Value("${platform.cache.ttl.models:21600s}") Duration modelsTtl) {

        String resolvedUsername = username;
        String resolvedKey = apiKey;
        if (resolvedUsername.isBlank() || resolvedKey.isBlank()) {
            JsonNode stored = readCredentialsFile(Path.of(System.getProperty("user.home"), ".kaggle", "kaggle.json"));
            if (stored != null) {
                resolvedUsername = stored.path("username").asText("");
                resolvedKey = stored.path("key").asText("");
            }
        }

        FacadeSettings settings = FacadeSettings.builder()
                .apiBaseUrl(apiBaseUrl)
                .siteUrl(siteUrl)
                .username(resolvedUsername)
                .apiKey(resolvedKey)
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .defaultDownloadPath(defaultDownloadPath)
                .defaultPageSize(defaultPageSize)
                .maxPageSize(maxPageSize)
                .competitionsTtl(competitionsTtl)
                .datasetsTtl(datasetsTtl)
                .modelsTtl(modelsTtl)
                .build();
        log.info("Facade settings loaded - {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The process-wide response cache. Lives as long as the application context.
     */
    @Bean
    public ResponseCache responseCache(Clock clock) {
        return new ResponseCache(clock);
    }

    @Bean
    public PlatformClient platformClient(RestClient.Builder restClientBuilder, FacadeSettings settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(settings.getConnectTimeout());
        requestFactory.setReadTimeout(settings.getReadTimeout());
        return new KagglePlatformClient(restClientBuilder.requestFactory(requestFactory), settings);
    }

    private static JsonNode readCredentialsFile(Path credentialsFile) {
        if (!Files.exists(credentialsFile)) {
            return null;
        }
        try {
            return objectMapper.readTree(credentialsFile.toFile());
        } catch (IOException e) {
            log.warn("Failed to read credentials file: {}", credentialsFile, e);
            return null;
        }
    }
}
