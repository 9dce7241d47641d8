package com.wellnessplatform.decision.narrative;

import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.tradeoff.DecisionTextRenderer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Template narrative: a short supportive paragraph followed by the rendered decision.
 * Default generator and the fallback for {@link AnthropicNarrativeGenerator}.
 */
@Component
public class HeuristicNarrativeGenerator implements NarrativeGenerator {

    private final Clock clock;

    public HeuristicNarrativeGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<String> narrate(TradeOffDecision decision) {
        return Mono.fromSupplier(() -> explain(decision) + "\n\n"
            + DecisionTextRenderer.render(decision, clock.getZone()));
    }

    String explain(TradeOffDecision decision) {
        List<String> parts = new ArrayList<>();
        StateSnapshot state = decision.stateSnapshot();

        if (state.sleepHours() < 6.0 || state.energyLevel() < 4) {
            parts.add("You're running on low reserves today.");
        } else if (state.stressLevel() == StressLevel.HIGH) {
            parts.add("Stress looks like it's weighing on you today.");
        } else {
            parts.add("Based on your current state, here is today's plan.");
        }

        String prioritized = categories(decision, DecisionAction.PRIORITIZE);
        if (!prioritized.isEmpty()) {
            parts.add("I've prioritized " + prioritized + " to give you the biggest benefit.");
        }
        String downgraded = categories(decision, DecisionAction.DOWNGRADE);
        if (!downgraded.isEmpty()) {
            parts.add("A lighter version of " + downgraded + " keeps the habit going.");
        }
        String skipped = categories(decision, DecisionAction.SKIP);
        if (!skipped.isEmpty()) {
            parts.add("It's okay to skip " + skipped + " today: rest is productive too.");
        }
        parts.add("Listening to your body is the smart choice.");
        return String.join(" ", parts);
    }

    private static String categories(TradeOffDecision decision, DecisionAction action) {
        return decision.decisions().stream()
            .filter(d -> d.action() == action)
            .map(d -> d.category().wireName())
            .collect(Collectors.joining(", "));
    }

    @Override
    public String mode() {
        return "heuristic";
    }
}
