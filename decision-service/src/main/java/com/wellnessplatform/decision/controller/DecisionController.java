package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.model.PlannedTask;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.decision.dto.DecisionRequest;
import com.wellnessplatform.decision.dto.DecisionResponse;
import com.wellnessplatform.decision.dto.HealthStatusDTO;
import com.wellnessplatform.decision.service.DecisionOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionController {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    private final DecisionOrchestratorService decisionService;

    public DecisionController(DecisionOrchestratorService decisionService) {
        this.decisionService = decisionService;
    }

    @PostMapping
    public Mono<ResponseEntity<DecisionResponse>> decide(@RequestBody DecisionRequest request) {
        if (request.state() == null) {
            return Mono.error(new IllegalArgumentException("state is required"));
        }
        List<PlannedTask> tasks = request.tasks() != null ? request.tasks() : List.of();
        log.info("Decision request received. tasks={} sleepHours={} energyLevel={}",
                 tasks.size(), request.state().sleepHours(), request.state().energyLevel());
        return decisionService.decide(request.state(), tasks)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Decision endpoint error", e));
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<List<TradeOffDecision>>> history() {
        log.info("History query received");
        return decisionService.history()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("History endpoint error", e));
    }

    @DeleteMapping("/history")
    public Mono<ResponseEntity<Void>> clearHistory() {
        log.info("History clear requested");
        return decisionService.clearHistory()
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthStatusDTO>> health() {
        return decisionService.health().map(ResponseEntity::ok);
    }
}
