package com.dataPlatform.platformFacade.util;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Utility class for logging facade calls without leaking secrets.
 */
@Slf4j
public class ApiCallLogger {

    private static final Set<String> SENSITIVE_KEYS = Set.of("api_key", "apiKey", "key", "token", "password");

    /**
     * Logs an operation call with sensitive parameters removed.
     *
     * @param operation Operation name
     * @param correlationId Correlation ID for this call
     * @param params Call parameters
     */
    public static void logCall(String operation, String correlationId, Map<String, ?> params) {
        log.info("API call - correlationId: {}, operation: {}, params: {}", correlationId, operation, safeParams(params));
    }

    /**
     * Copy of {@code params} without sensitive entries, in the original order.
     */
    public static Map<String, Object> safeParams(Map<String, ?> params) {
        Map<String, Object> safe = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((name, value) -> {
                if (!SENSITIVE_KEYS.contains(name)) {
                    safe.put(name, value);
                }
            });
        }
        return safe;
    }
}
