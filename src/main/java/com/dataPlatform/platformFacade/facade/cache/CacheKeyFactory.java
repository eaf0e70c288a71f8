package com.dataPlatform.platformFacade.facade.cache;

import com.dataPlatform.platformFacade.facade.normalization.ObjectNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds cache keys from an operation name and its result-affecting parameters.
 *
 * Keys look like {@code datasets.search:{"page":1,"search":"titanic"}}.
 * Parameters are normalized and sorted by name, so argument order never changes the key.
 */
@Component
@RequiredArgsConstructor
public class CacheKeyFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ObjectNormalizer normalizer;

    /**
     * @param operation Operation name (e.g. "datasets.search")
     * @param parameters Parameter name to value; null values are kept
     * @return Deterministic key
     */
    public String keyFor(String operation, Map<String, ?> parameters) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }

        Map<String, Object> sorted = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((name, value) -> sorted.put(name, normalizer.normalize(value)));
        }

        try {
            return operation + ":" + objectMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build cache key for " + operation, e);
        }
    }
}
