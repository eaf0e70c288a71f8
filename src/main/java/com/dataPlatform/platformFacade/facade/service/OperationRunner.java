package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.cache.CacheKeyFactory;
import com.dataPlatform.platformFacade.facade.cache.ResponseCache;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.error.ClassifiedError;
import com.dataPlatform.platformFacade.facade.error.ErrorClassifier;
import com.dataPlatform.platformFacade.facade.error.ErrorKind;
import com.dataPlatform.platformFacade.facade.normalization.ObjectNormalizer;
import com.dataPlatform.platformFacade.facade.validation.ValidationResult;
import com.dataPlatform.platformFacade.util.ApiCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs facade operations through the shared pipeline.
 *
 * Workflow steps:
 * VALIDATE -> (IF cacheable: CACHE_READ -> hit ? RESPOND) -> UPSTREAM_CALL
 * -> NORMALIZE -> (IF cacheable: CACHE_WRITE) -> RESPOND
 *
 * Any failure after validation is classified and returned as an error envelope.
 * Nothing is thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationRunner {

    private final ResponseCache responseCache;
    private final CacheKeyFactory cacheKeyFactory;
    private final ObjectNormalizer normalizer;
    private final ErrorClassifier errorClassifier;
    private final FacadeSettings settings;

    /**
     * Executes an operation.
     *
     * @param operation Operation definition
     * @return Success or error envelope, never null
     */
    public OperationResponse execute(FacadeOperation operation) {
        String correlationId = UUID.randomUUID().toString();
        String name = operation.getName();
        ApiCallLogger.logCall(name, correlationId, operation.getParameters());

        try {
            ValidationResult validation = operation.getValidation();
            if (validation != null && !validation.valid()) {
                log.warn("Validation failed - correlationId: {}, operation: {}, message: {}",
                        correlationId, name, validation.message());
                return OperationResponse.error(ErrorKind.VALIDATION, validation.message());
            }

            String cacheKey = null;
            if (operation.getCacheCategory() != null) {
                cacheKey = cacheKeyFactory.keyFor(name, operation.getParameters());
                Optional<Object> cached = responseCache.get(cacheKey, settings.ttlFor(operation.getCacheCategory()));
                if (cached.isPresent()) {
                    log.debug("Cache hit - correlationId: {}, operation: {}", correlationId, name);
                    return OperationResponse.success(asPayload(cached.get()));
                }
                log.debug("Cache miss - correlationId: {}, operation: {}", correlationId, name);
            }

            Map<String, Object> payload = normalizer.normalizeFields(operation.getUpstreamCall().fetch());

            if (cacheKey != null) {
                responseCache.set(cacheKey, payload);
            }

            log.info("Operation completed - correlationId: {}, operation: {}, fields: {}",
                    correlationId, name, payload.keySet());
            return OperationResponse.success(payload);

        } catch (Exception e) {
            ClassifiedError error = errorClassifier.classify(e);
            log.error("Operation failed - correlationId: {}, operation: {}, errorType: {}, error: {}",
                    correlationId, name, error.kind().getCode(), ErrorClassifier.describe(e));
            return OperationResponse.error(error.kind(), error.message());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asPayload(Object cached) {
        if (cached instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("data", cached);
        return wrapped;
    }
}
