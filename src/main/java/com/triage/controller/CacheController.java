package com.triage.controller;

import com.triage.model.dto.CacheStatistics;
import com.triage.service.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Response cache management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCache responseCache;

    public CacheController(ResponseCache responseCache) {
        this.responseCache = responseCache;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(responseCache.getStatistics());
    }

    /**
     * Drop every stored response. Computations already in flight still complete and store their result.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        responseCache.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Response cache cleared"
        ));
    }
}
