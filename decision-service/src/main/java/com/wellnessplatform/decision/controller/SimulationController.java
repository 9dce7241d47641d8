package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.simulation.SimulationResult;
import com.wellnessplatform.decision.dto.SimulationRequest;
import com.wellnessplatform.decision.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/simulation")
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<SimulationResult>> run(@RequestBody SimulationRequest request) {
        log.info("Week simulation requested. scenario={}", request.scenario());
        return simulationService.simulate(request)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Simulation endpoint error", e));
    }
}
