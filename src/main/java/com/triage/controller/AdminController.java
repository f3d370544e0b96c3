package com.triage.controller;

import com.triage.model.dto.TrainingReport;
import com.triage.service.training.TrainingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Admin operations on the routing models.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final TrainingService trainingService;

    public AdminController(TrainingService trainingService) {
        this.trainingService = trainingService;
    }

    /**
     * Refit the feature extractor and anomaly detector now.
     */
    @PostMapping("/retrain")
    public Mono<ResponseEntity<TrainingReport>> retrain() {
        log.info("Admin: retrain requested");
        return Mono.fromCallable(trainingService::retrain)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
