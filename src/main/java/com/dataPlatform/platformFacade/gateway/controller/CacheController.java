package com.dataPlatform.platformFacade.gateway.controller;

import com.dataPlatform.platformFacade.facade.cache.ResponseCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache administration: statistics and manual clear.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ResponseCache responseCache;

    @GetMapping
    public ResponseEntity<ResponseCache.CacheStatistics> statistics() {
        return ResponseEntity.ok(responseCache.statistics());
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        int removed = responseCache.clear();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("entries_removed", removed);
        return ResponseEntity.ok(response);
    }
}
