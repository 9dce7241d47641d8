package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.burnout.BurnoutForecast;
import com.wellnessplatform.common.pattern.PatternReport;
import com.wellnessplatform.common.pattern.PlanAdjustment;
import com.wellnessplatform.common.temporal.TemporalInsight;
import com.wellnessplatform.decision.dto.PlanAdjustRequest;
import com.wellnessplatform.decision.dto.TemporalRequest;
import com.wellnessplatform.decision.service.InsightService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class InsightController {

    private static final Logger log = LoggerFactory.getLogger(InsightController.class);

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @GetMapping("/insights/burnout")
    public Mono<ResponseEntity<BurnoutForecast>> burnout() {
        log.info("Burnout forecast requested");
        return insightService.burnout()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Burnout endpoint error", e));
    }

    @GetMapping("/insights/patterns")
    public Mono<ResponseEntity<PatternReport>> patterns() {
        log.info("Weekly pattern report requested");
        return insightService.patterns()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Pattern endpoint error", e));
    }

    @PostMapping("/insights/temporal")
    public Mono<ResponseEntity<TemporalInsight>> temporal(@RequestBody TemporalRequest request) {
        if (request.state() == null) {
            return Mono.error(new IllegalArgumentException("state is required"));
        }
        log.info("Temporal analysis requested");
        return insightService.temporal(request.state())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Temporal endpoint error", e));
    }

    @PostMapping("/plans/adjust")
    public Mono<ResponseEntity<PlanAdjustment>> adjust(@RequestBody PlanAdjustRequest request) {
        int count = request.upcomingTasks() != null ? request.upcomingTasks().size() : 0;
        log.info("Plan adjustment requested. upcomingTasks={}", count);
        return insightService.adjustPlan(request.upcomingTasks() != null ? request.upcomingTasks() : List.of())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Plan adjustment endpoint error", e));
    }
}
