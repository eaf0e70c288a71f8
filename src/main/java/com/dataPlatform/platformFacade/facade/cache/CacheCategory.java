package com.dataPlatform.platformFacade.facade.cache;

/**
 * TTL classes of cached operations.
 */
public enum CacheCategory {
    COMPETITIONS,
    DATASETS,
    MODELS
}
