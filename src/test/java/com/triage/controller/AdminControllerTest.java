package com.triage.controller;

import com.triage.model.dto.CacheStatistics;
import com.triage.model.dto.TrainingReport;
import com.triage.service.cache.ResponseCache;
import com.triage.service.training.TrainingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminControllerTest {

    private TrainingService trainingService;
    private ResponseCache responseCache;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        trainingService = mock(TrainingService.class);
        responseCache = mock(ResponseCache.class);
        webTestClient = WebTestClient.bindToController(
                        new AdminController(trainingService), new CacheController(responseCache))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testRetrain() {
        when(trainingService.retrain()).thenReturn(TrainingReport.builder()
                .fitted(true)
                .documents(66)
                .modalitySizes(Map.of("simple", 20))
                .vocabularySize(50)
                .completedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .build());

        webTestClient.post().uri("/v1/admin/retrain")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.fitted").isEqualTo(true)
                .jsonPath("$.documents").isEqualTo(66)
                .jsonPath("$.vocabularySize").isEqualTo(50);
    }

    @Test
    void testClearCache() {
        webTestClient.post().uri("/v1/cache/clear")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success");

        verify(responseCache).clear();
    }

    @Test
    void testCacheStats() {
        when(responseCache.getStatistics()).thenReturn(CacheStatistics.builder()
                .hits(5)
                .sharedWaits(2)
                .misses(3)
                .hitRate(0.7)
                .build());

        webTestClient.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hits").isEqualTo(5)
                .jsonPath("$.sharedWaits").isEqualTo(2)
                .jsonPath("$.hitRate").isEqualTo(0.7);
    }
}
