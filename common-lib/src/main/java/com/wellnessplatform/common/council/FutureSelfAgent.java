package com.wellnessplatform.common.council;

import com.wellnessplatform.common.model.TradeOffDecision;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Speaks for long-term habits. Reads the skip rate over the most recent
 * {@value #WINDOW} history entries; an entry counts as skipped when any of its
 * category decisions was a SKIP.
 */
public final class FutureSelfAgent implements CouncilAgent {

    static final int WINDOW = 7;

    @Override
    public AgentRecommendation recommend(CouncilContext context) {
        double skipRate = recentSkipRate(context.history());
        String pct = String.format(Locale.ROOT, "%.0f%%", skipRate * 100);

        if (skipRate > 0.5) {
            return new AgentRecommendation(role(), CouncilAction.PROCEED,
                "Skip rate is " + pct + " this week. Skipping again risks habit collapse. "
                    + "Your future self needs consistency.",
                0.9, Map.of());
        }
        if (skipRate > 0.3) {
            return new AgentRecommendation(role(), CouncilAction.MODIFY,
                "Skip rate is " + pct + ". Consider a lighter version to maintain habit momentum.",
                0.7, Map.of());
        }
        return new AgentRecommendation(role(), CouncilAction.PROCEED,
            "Good consistency (" + pct + " skip rate). Your future self will thank you.",
            0.8, Map.of());
    }

    static double recentSkipRate(List<TradeOffDecision> history) {
        if (history.isEmpty()) return 0.0;
        List<TradeOffDecision> recent = history.subList(Math.max(0, history.size() - WINDOW), history.size());
        long skipped = recent.stream().filter(TradeOffDecision::hasSkip).count();
        return (double) skipped / recent.size();
    }

    @Override
    public AgentRole role() {
        return AgentRole.FUTURE_SELF;
    }
}
