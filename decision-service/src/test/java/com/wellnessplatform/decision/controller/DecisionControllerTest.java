package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.decision.TestDecisions;
import com.wellnessplatform.decision.dto.DecisionResponse;
import com.wellnessplatform.decision.dto.HealthStatusDTO;
import com.wellnessplatform.decision.service.DecisionOrchestratorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@WebFluxTest(controllers = DecisionController.class)
class DecisionControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private DecisionOrchestratorService decisionService;

    @Test
    @DisplayName("POST /api/v1/decisions → 200 with decision, summary and narrative")
    void decide_ok() {
        DecisionResponse response = new DecisionResponse(
            TestDecisions.decision("abc", 0, DecisionAction.SKIP),
            "No active constraints - full adherence possible", "Take it easy.");
        when(decisionService.decide(any(), any())).thenReturn(Mono.just(response));

        client.post().uri("/api/v1/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {"state":{"sleepHours":5.5,"energyLevel":3,"stressLevel":"high","timeAvailableHours":2},
                 "tasks":[{"category":"fitness","name":"HIIT","durationMinutes":45,"intensity":0.9}]}
                """)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.decision.decisionId").isEqualTo("abc")
            .jsonPath("$.decision.decisions[0].action").isEqualTo("SKIP")
            .jsonPath("$.decision.decisions[0].category").isEqualTo("fitness")
            .jsonPath("$.narrative").isEqualTo("Take it easy.");

        verify(decisionService).decide(eq(StateSnapshot.of(5.5, 3, StressLevel.HIGH, 2.0)), any());
    }

    @Test
    @DisplayName("missing state → 400 with a JSON error body")
    void decide_missingState() {
        client.post().uri("/api/v1/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"tasks\":[]}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.status").isEqualTo(400)
            .jsonPath("$.message").isEqualTo("state is required");

        verifyNoInteractions(decisionService);
    }

    @Test
    @DisplayName("unknown stress level → 400")
    void decide_badEnum() {
        client.post().uri("/api/v1/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"state\":{\"sleepHours\":7,\"energyLevel\":5,\"stressLevel\":\"EXTREME\","
                + "\"timeAvailableHours\":1}}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("GET /history returns the stored decisions in order")
    void history() {
        when(decisionService.history()).thenReturn(Mono.just(List.of(
            TestDecisions.decision("first", 2, DecisionAction.MAINTAIN),
            TestDecisions.decision("second", 1, DecisionAction.SKIP))));

        client.get().uri("/api/v1/decisions/history")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[1].decisionId").isEqualTo("second");
    }

    @Test
    @DisplayName("DELETE /history → 204")
    void clearHistory() {
        when(decisionService.clearHistory()).thenReturn(Mono.empty());

        client.delete().uri("/api/v1/decisions/history")
            .exchange()
            .expectStatus().isNoContent();

        verify(decisionService).clearHistory();
    }

    @Test
    @DisplayName("GET /health reports status and narrative mode")
    void health() {
        when(decisionService.health()).thenReturn(Mono.just(new HealthStatusDTO("UP", 3, 50, "heuristic")));

        client.get().uri("/api/v1/decisions/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.narrativeMode").isEqualTo("heuristic");
    }
}
