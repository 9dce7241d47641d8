package com.wellnessplatform.decision.narrative;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellnessplatform.common.exception.AgentException;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.decision.TestDecisions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicNarrativeGeneratorTest {

    private final HeuristicNarrativeGenerator fallback = new HeuristicNarrativeGenerator(TestDecisions.CLOCK);

    private AnthropicNarrativeGenerator generator(String baseUrl) {
        return new AnthropicNarrativeGenerator(WebClient.builder(), baseUrl, new ObjectMapper(), fallback,
            "test-key", "claude-haiku-4-5-20251001", 2000);
    }

    @Nested
    @DisplayName("narrate()")
    class NarrateTests {

        @Test
        @DisplayName("unreachable API → heuristic text, never an error")
        void unreachable_fallsBack() {
            TradeOffDecision decision = TestDecisions.decision("n1", 0, DecisionAction.SKIP);
            String expected = fallback.narrate(decision).block();

            StepVerifier.create(generator("http://localhost:1").narrate(decision))
                .expectNext(expected)
                .expectComplete()
                .verify(Duration.ofSeconds(10));
        }
    }

    @Nested
    @DisplayName("extractText()")
    class ExtractTests {

        private final AnthropicNarrativeGenerator generator = generator("http://localhost:1");

        @Test
        @DisplayName("first content block text, trimmed")
        void firstContentBlock() {
            String body = "{\"content\":[{\"type\":\"text\",\"text\":\"  Rest is part of training. \"}]}";
            assertEquals("Rest is part of training.", generator.extractText(body));
        }

        @Test
        @DisplayName("empty content → AgentException naming the generator")
        void emptyContent() {
            AgentException e = assertThrows(AgentException.class,
                () -> generator.extractText("{\"content\":[]}"));
            assertEquals("NarrativeGenerator", e.getAgentName());
        }

        @Test
        @DisplayName("non-JSON body → AgentException")
        void notJson() {
            assertThrows(AgentException.class, () -> generator.extractText("<html>bad gateway</html>"));
        }
    }

    @Test
    @DisplayName("prompt carries state, constraints and each decision")
    void prompt() {
        String prompt = generator("http://localhost:1")
            .buildPrompt(TestDecisions.decision("p1", 0, DecisionAction.SKIP));

        assertTrue(prompt.contains("State: sleep 8.0h, energy 7/10, stress LOW"));
        assertTrue(prompt.contains("Constraints: None"));
        assertTrue(prompt.contains("- FITNESS: SKIP - test"));
    }
}
