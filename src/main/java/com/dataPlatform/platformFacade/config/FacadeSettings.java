package com.dataPlatform.platformFacade.config;

import com.dataPlatform.platformFacade.facade.cache.CacheCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Immutable facade configuration, bound from application.yaml by {@link FacadeConfig}.
 */
@Getter
@Builder
@ToString(exclude = "apiKey")
public class FacadeSettings {

    @Builder.Default
    private final String apiBaseUrl = "https://www.kaggle.com/api/v1";

    /**
     * Public site root used to build links in responses.
     */
    @Builder.Default
    private final String siteUrl = "https://www.kaggle.com";

    private final String username;

    private final String apiKey;

    @Builder.Default
    private final Duration connectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private final Duration readTimeout = Duration.ofSeconds(60);

    @Builder.Default
    private final String defaultDownloadPath = "./kaggle_data";

    @Builder.Default
    private final int defaultPageSize = 20;

    @Builder.Default
    private final int maxPageSize = 100;

    @Builder.Default
    private final Duration competitionsTtl = Duration.ofHours(1);

    @Builder.Default
    private final Duration datasetsTtl = Duration.ofHours(6);

    @Builder.Default
    private final Duration modelsTtl = Duration.ofHours(6);

    /**
     * TTL applied when reading cached responses of the given category.
     */
    public Duration ttlFor(CacheCategory category) {
        return switch (category) {
            case COMPETITIONS -> competitionsTtl;
            case DATASETS -> datasetsTtl;
            case MODELS -> modelsTtl;
        };
    }

    /**
     * Returns the caller's download path, or the configured default when none is given.
     */
    public String resolveDownloadPath(String customPath) {
        if (customPath != null && !customPath.isBlank()) {
            return customPath;
        }
        return defaultDownloadPath;
    }
}
