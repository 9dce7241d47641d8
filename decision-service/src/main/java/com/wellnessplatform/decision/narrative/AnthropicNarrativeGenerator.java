package com.wellnessplatform.decision.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellnessplatform.common.exception.AgentException;
import com.wellnessplatform.common.model.DomainDecision;
import com.wellnessplatform.common.model.TradeOffDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Narrative from the Anthropic Messages API, decorating a fallback generator.
 *
 * <p>Non-blocking: the HTTP call is a {@code Mono} chain bounded by {@code timeoutMs}.
 * Any failure (timeout, HTTP error, empty or unparsable body) resolves to the
 * fallback's text, so the decision endpoint never fails because of narrative.
 */
public class AnthropicNarrativeGenerator implements NarrativeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicNarrativeGenerator.class);

    static final String AGENT_NAME = "NarrativeGenerator";
    static final int MAX_TOKENS = 300;

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final NarrativeGenerator fallback;
    private final String apiKey;
    private final String model;
    private final long timeoutMs;

    public AnthropicNarrativeGenerator(WebClient.Builder builder, String baseUrl, ObjectMapper objectMapper,
                                       NarrativeGenerator fallback, String apiKey, String model, long timeoutMs) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.fallback     = fallback;
        this.apiKey       = apiKey;
        this.model        = model;
        this.timeoutMs    = timeoutMs;
    }

    @Override
    public Mono<String> narrate(TradeOffDecision decision) {
        return Mono.fromCallable(() -> buildPrompt(decision))
            .flatMap(this::callAnthropicApi)
            .doOnSuccess(text -> log.info("[Narrative] Generated. model={} chars={} traceId={}",
                                          model, text.length(), decision.decisionId()))
            .onErrorResume(e -> {
                log.warn("[Narrative] API call failed, using heuristic text. traceId={} reason={}",
                         decision.decisionId(), e.getMessage());
                return fallback.narrate(decision);
            });
    }

    String buildPrompt(TradeOffDecision decision) {
        String decisions = decision.decisions().stream()
            .map(AnthropicNarrativeGenerator::describe)
            .collect(Collectors.joining("\n"));
        String constraints = decision.constraintsActive().isEmpty()
            ? "None"
            : decision.constraintsActive().stream().map(Object::toString).collect(Collectors.joining(", "));

        return String.format(Locale.ROOT, """
            You are a supportive health coach explaining today's plan trade-offs.
            Acknowledge the person's state, explain why activities were prioritized, reduced or skipped,
            frame trade-offs as smart choices, and end with encouragement. 3-4 sentences, no medical jargon.

            State: sleep %.1fh, energy %d/10, stress %s
            Constraints: %s
            Decisions:
            %s
            Summary: %s

            Respond with the explanation text only.
            """,
            decision.stateSnapshot().sleepHours(),
            decision.stateSnapshot().energyLevel(),
            decision.stateSnapshot().stressLevel(),
            constraints,
            decisions.isEmpty() ? "No planned tasks" : decisions,
            decision.reasoningSummary());
    }

    private static String describe(DomainDecision d) {
        return "- " + d.category().wireName().toUpperCase(Locale.ROOT) + ": " + d.action() + " - " + d.reasoning();
    }

    private Mono<String> callAnthropicApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", MAX_TOKENS,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(this::extractText);
    }

    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new AgentException(AGENT_NAME, "Unparsable Anthropic response", e);
        }
        String text = root.path("content").path(0).path("text").asText("").trim();
        if (text.isEmpty()) {
            throw new AgentException(AGENT_NAME, "Empty Anthropic response");
        }
        return text;
    }

    @Override
    public String mode() {
        return "anthropic";
    }
}
