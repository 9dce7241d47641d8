package com.wellnessplatform.decision.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wellnessplatform.common.burnout.BurnoutPredictor;
import com.wellnessplatform.common.constraint.ConstraintEvaluator;
import com.wellnessplatform.common.constraint.ConstraintThresholds;
import com.wellnessplatform.common.council.ConsensusEngine;
import com.wellnessplatform.common.council.HealthCouncil;
import com.wellnessplatform.common.council.WeightedConsensusStrategy;
import com.wellnessplatform.common.negotiator.GoalNegotiator;
import com.wellnessplatform.common.pattern.PlanAdjuster;
import com.wellnessplatform.common.priority.PriorityMatrix;
import com.wellnessplatform.common.simulation.WeekSimulator;
import com.wellnessplatform.common.temporal.TemporalReasoner;
import com.wellnessplatform.common.tradeoff.TradeOffEngine;
import com.wellnessplatform.decision.narrative.AnthropicNarrativeGenerator;
import com.wellnessplatform.decision.narrative.HeuristicNarrativeGenerator;
import com.wellnessplatform.decision.narrative.NarrativeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the pure engine components from {@code common-lib} as Spring beans.
 * Thresholds and narrative settings come from {@code application.yml}.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${engine.thresholds.min-sleep-hours:6.0}")
    private double minSleepHours;

    @Value("${engine.thresholds.critical-sleep-hours:5.0}")
    private double criticalSleepHours;

    @Value("${engine.thresholds.low-energy:4}")
    private int lowEnergyThreshold;

    @Value("${engine.thresholds.critical-energy:2}")
    private int criticalEnergyThreshold;

    @Value("${engine.thresholds.min-time-hours:0.5}")
    private double minTimeHours;

    @Value("${engine.thresholds.limited-time-hours:1.5}")
    private double limitedTimeHours;

    @Value("${engine.thresholds.max-consecutive-high-effort:3}")
    private int maxConsecutiveHighEffort;

    @Value("${engine.thresholds.sleep-debt-warning-hours:3.0}")
    private double sleepDebtWarningHours;

    @Value("${engine.thresholds.sleep-debt-critical-hours:6.0}")
    private double sleepDebtCriticalHours;

    @Value("${engine.pattern.window-days:7}")
    private int patternWindowDays;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.model:claude-haiku-4-5-20251001}")
    private String anthropicModel;

    @Value("${anthropic.timeout-ms:4000}")
    private long anthropicTimeoutMs;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ConstraintThresholds constraintThresholds() {
        return new ConstraintThresholds(minSleepHours, criticalSleepHours, lowEnergyThreshold,
            criticalEnergyThreshold, minTimeHours, limitedTimeHours, maxConsecutiveHighEffort,
            sleepDebtWarningHours, sleepDebtCriticalHours);
    }

    @Bean
    public ConstraintEvaluator constraintEvaluator(ConstraintThresholds thresholds) {
        return new ConstraintEvaluator(thresholds);
    }

    @Bean
    public PriorityMatrix priorityMatrix() {
        return new PriorityMatrix();
    }

    /** Preferences are bound per request from the stored profile. */
    @Bean
    public TradeOffEngine tradeOffEngine(PriorityMatrix priorityMatrix, Clock clock) {
        return new TradeOffEngine(priorityMatrix, null, clock);
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new WeightedConsensusStrategy();
    }

    @Bean
    public HealthCouncil healthCouncil(ConsensusEngine consensusEngine) {
        return new HealthCouncil(HealthCouncil.defaultAgents(), consensusEngine);
    }

    @Bean
    public BurnoutPredictor burnoutPredictor(Clock clock) {
        return new BurnoutPredictor(clock);
    }

    @Bean
    public PlanAdjuster planAdjuster(Clock clock) {
        return new PlanAdjuster(clock, patternWindowDays);
    }

    @Bean
    public TemporalReasoner temporalReasoner(Clock clock) {
        return new TemporalReasoner(clock);
    }

    @Bean
    public GoalNegotiator goalNegotiator() {
        return new GoalNegotiator();
    }

    @Bean
    public WeekSimulator weekSimulator(ConstraintEvaluator evaluator, PriorityMatrix priorityMatrix, Clock clock) {
        return new WeekSimulator(evaluator, priorityMatrix, clock);
    }

    @Bean
    @Primary
    public NarrativeGenerator narrativeGenerator(HeuristicNarrativeGenerator heuristic,
                                                 WebClient.Builder builder,
                                                 ObjectMapper objectMapper) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("[Narrative] No Anthropic API key configured, using heuristic narrative");
            return heuristic;
        }
        log.info("[Narrative] Anthropic narrative enabled. model={} timeoutMs={}", anthropicModel, anthropicTimeoutMs);
        return new AnthropicNarrativeGenerator(builder, anthropicBaseUrl, objectMapper, heuristic,
            anthropicApiKey, anthropicModel, anthropicTimeoutMs);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
