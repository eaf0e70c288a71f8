package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.facade.cache.CacheCategory;
import com.dataPlatform.platformFacade.facade.validation.ValidationResult;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * One facade operation as run by {@link OperationRunner}.
 */
@Getter
@Builder
public class FacadeOperation {

    /**
     * Operation name, also the cache key prefix (e.g. "datasets.search").
     */
    private final String name;

    /**
     * Parameters that affect the result. Used for the cache key and for logging.
     */
    private final Map<String, Object> parameters;

    /**
     * Local parameter checks. Null means nothing to check.
     */
    private final ValidationResult validation;

    /**
     * TTL class; null for operations that must never be cached (downloads).
     */
    private final CacheCategory cacheCategory;

    private final UpstreamCall upstreamCall;

    /**
     * The platform call, returning raw payload fields to be normalized.
     */
    @FunctionalInterface
    public interface UpstreamCall {
        Map<String, Object> fetch() throws Exception;
    }
}
