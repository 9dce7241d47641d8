package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.negotiator.NegotiationResult;
import com.wellnessplatform.decision.dto.GoalNegotiationRequest;
import com.wellnessplatform.decision.service.NegotiationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/negotiator")
public class NegotiatorController {

    private static final Logger log = LoggerFactory.getLogger(NegotiatorController.class);

    private final NegotiationService negotiationService;

    public NegotiatorController(NegotiationService negotiationService) {
        this.negotiationService = negotiationService;
    }

    @PostMapping
    public Mono<ResponseEntity<NegotiationResult>> negotiate(@RequestBody GoalNegotiationRequest request) {
        if (request.goal() == null || request.goal().isBlank()) {
            return Mono.error(new IllegalArgumentException("goal is required"));
        }
        log.info("Goal negotiation requested");
        return negotiationService.negotiate(request.goal())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Negotiator endpoint error", e));
    }
}
