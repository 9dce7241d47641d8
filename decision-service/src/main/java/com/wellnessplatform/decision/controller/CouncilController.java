package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.council.ConsensusDecision;
import com.wellnessplatform.decision.dto.CouncilRequest;
import com.wellnessplatform.decision.service.CouncilDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/council")
public class CouncilController {

    private static final Logger log = LoggerFactory.getLogger(CouncilController.class);

    private final CouncilDispatchService councilService;

    public CouncilController(CouncilDispatchService councilService) {
        this.councilService = councilService;
    }

    @PostMapping("/deliberate")
    public Mono<ResponseEntity<ConsensusDecision>> deliberate(@RequestBody CouncilRequest request) {
        if (request.state() == null) {
            return Mono.error(new IllegalArgumentException("state is required"));
        }
        if (request.activity() == null || request.activity().isBlank()) {
            return Mono.error(new IllegalArgumentException("activity is required"));
        }
        log.info("Council deliberation requested. activity={}", request.activity());
        return councilService.deliberate(request.state(), request.activity(), request.goal())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Council endpoint error. activity={}", request.activity(), e));
    }
}
