package com.triage.service;

import com.triage.config.TriageProperties;
import com.triage.model.dto.TrainingReport;
import com.triage.service.cache.ResponseCache;
import com.triage.service.training.TrainingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background upkeep: initial fit, periodic refit and cache expiry sweep.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final TrainingService trainingService;
    private final ResponseCache responseCache;
    private final TriageProperties properties;

    public MaintenanceScheduler(TrainingService trainingService,
                                ResponseCache responseCache,
                                TriageProperties properties) {
        this.trainingService = trainingService;
        this.responseCache = responseCache;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initialFit() {
        TrainingReport report = trainingService.retrain();
        if (!report.isFitted()) {
            log.warn("No model fitted at startup, routing returns 503 until a refit succeeds: {}",
                    report.getReason());
        }
    }

    @Scheduled(initialDelayString = "#{@triageProperties.training.refitInterval.toMillis()}",
            fixedDelayString = "#{@triageProperties.training.refitInterval.toMillis()}")
    public void refit() {
        if (!properties.getTraining().isEnabled()) {
            return;
        }
        try {
            trainingService.retrain();
        } catch (RuntimeException e) {
            log.error("Scheduled refit failed, keeping previous models", e);
        }
    }

    @Scheduled(initialDelayString = "#{@triageProperties.cache.sweepInterval.toMillis()}",
            fixedDelayString = "#{@triageProperties.cache.sweepInterval.toMillis()}")
    public void sweepExpired() {
        responseCache.sweepExpired();
    }
}
