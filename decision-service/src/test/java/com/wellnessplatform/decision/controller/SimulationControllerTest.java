package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.constraint.ConstraintEvaluator;
import com.wellnessplatform.common.priority.PriorityMatrix;
import com.wellnessplatform.common.simulation.SimulationResult;
import com.wellnessplatform.common.simulation.SimulationScenario;
import com.wellnessplatform.common.simulation.WeekSimulator;
import com.wellnessplatform.decision.TestDecisions;
import com.wellnessplatform.decision.dto.SimulationRequest;
import com.wellnessplatform.decision.service.SimulationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@WebFluxTest(controllers = SimulationController.class)
class SimulationControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private SimulationService simulationService;

    @Test
    @DisplayName("POST /simulation/run → seven projections, scenario by wire name")
    void run_ok() {
        SimulationResult result = new WeekSimulator(new ConstraintEvaluator(), new PriorityMatrix(), TestDecisions.CLOCK)
            .simulate(TestDecisions.rested(), SimulationScenario.PEAK, 2.0, null, null, 3);
        when(simulationService.simulate(any())).thenReturn(Mono.just(result));

        client.post().uri("/api/v1/simulation/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"scenario\":\"peak\",\"dailyHours\":2.0}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.scenario").isEqualTo("peak")
            .jsonPath("$.projections.length()").isEqualTo(7)
            .jsonPath("$.insights.length()").isEqualTo(3);

        ArgumentCaptor<SimulationRequest> request = ArgumentCaptor.forClass(SimulationRequest.class);
        verify(simulationService).simulate(request.capture());
        assertEquals(SimulationScenario.PEAK, request.getValue().scenario());
        assertEquals(2.0, request.getValue().dailyHours().doubleValue(), 1e-9);
    }

    @Test
    @DisplayName("insufficient history → 400 with the service's message")
    void run_insufficientHistory() {
        when(simulationService.simulate(any()))
            .thenReturn(Mono.error(new IllegalArgumentException("Insufficient data. Record 3 more decision(s) to calibrate the simulation.")));

        client.post().uri("/api/v1/simulation/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"scenario\":\"preventive\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Insufficient data. Record 3 more decision(s) to calibrate the simulation.");
    }

    @Test
    @DisplayName("unknown scenario → 400")
    void run_unknownScenario() {
        client.post().uri("/api/v1/simulation/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"scenario\":\"holiday\"}")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(simulationService);
    }
}
