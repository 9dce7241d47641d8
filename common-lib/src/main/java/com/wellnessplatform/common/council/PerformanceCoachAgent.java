package com.wellnessplatform.common.council;

import java.util.Map;

/** Pushes for output on high-energy days, strategic rest on depleted ones. */
public final class PerformanceCoachAgent implements CouncilAgent {

    private static final int HIGH_ENERGY = 7;
    private static final int LOW_ENERGY  = 3;

    @Override
    public AgentRecommendation recommend(CouncilContext context) {
        int energy = context.state().energyLevel();

        if (energy >= HIGH_ENERGY && context.activityMentions("exercise", "work")) {
            return new AgentRecommendation(role(), CouncilAction.PROCEED,
                "High energy (" + energy + "/10). Optimal window for high-value activities aligned with goal: "
                    + context.goal(),
                0.9, Map.of("Work", 1.5, "Exercise", 1.4));
        }
        if (energy <= LOW_ENERGY) {
            return new AgentRecommendation(role(), CouncilAction.MODIFY,
                "Low energy (" + energy + "/10). Recommend strategic rest to prevent diminishing returns.",
                0.7, Map.of("Sleep", 1.3, "Work", 0.6));
        }
        return new AgentRecommendation(role(), CouncilAction.PROCEED,
            "Moderate energy (" + energy + "/10). Maintain planned activities.",
            0.6, Map.of());
    }

    @Override
    public AgentRole role() {
        return AgentRole.PERFORMANCE_COACH;
    }
}
