package com.triage.controller;

import com.triage.model.Query;
import com.triage.model.dto.RouteRequest;
import com.triage.model.dto.RouteResponse;
import com.triage.service.cache.ResponseCache;
import com.triage.service.monitor.LoadMonitor;
import com.triage.service.monitor.PerformanceTracker;
import com.triage.service.routing.RouteResult;
import com.triage.service.routing.RoutingEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query routing endpoint and aggregate statistics.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class RouteController {

    private final RoutingEngine routingEngine;
    private final PerformanceTracker performanceTracker;
    private final ResponseCache responseCache;
    private final LoadMonitor loadMonitor;
    private final Clock clock;

    public RouteController(RoutingEngine routingEngine,
                           PerformanceTracker performanceTracker,
                           ResponseCache responseCache,
                           LoadMonitor loadMonitor,
                           Clock clock) {
        this.routingEngine = routingEngine;
        this.performanceTracker = performanceTracker;
        this.responseCache = responseCache;
        this.loadMonitor = loadMonitor;
        this.clock = clock;
    }

    /**
     * Route a query to a model and return its response.
     * Routing blocks on inference, so it runs on the bounded elastic scheduler.
     */
    @PostMapping(value = "/route", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RouteResponse>> route(@RequestBody RouteRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return Mono.error(new IllegalArgumentException("Query text must not be empty"));
        }
        Query query = Query.of(request.getQuery(), request.getCallerId(), clock.instant());
        log.debug("Received query {} ({} chars)", query.getId(), query.getText().length());

        return Mono.fromCallable(() -> routingEngine.route(query))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(toResponse(query, result)));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routing", performanceTracker.summary());
        body.put("cache", responseCache.getStatistics());
        body.put("load", loadMonitor.current());
        body.put("load_degraded", loadMonitor.isDegraded());
        return ResponseEntity.ok(body);
    }

    private static RouteResponse toResponse(Query query, RouteResult result) {
        return RouteResponse.builder()
                .queryId(query.getId())
                .responseText(result.getResponseText())
                .selectedModelName(result.getServedBy().getModel())
                .anomalyScore(result.getDecision().getAnomalyScore())
                .cacheHit(result.isCacheHit())
                .build();
    }
}
