package com.wellnessplatform.common.council;

import com.wellnessplatform.common.model.StressLevel;

import java.util.Map;

/** Watches stress load. Blocks extra cognitive work under high stress. */
public final class WellnessGuardianAgent implements CouncilAgent {

    @Override
    public AgentRecommendation recommend(CouncilContext context) {
        StressLevel stress = context.state().stressLevel();

        if (stress == StressLevel.HIGH && context.activityMentions("work", "deadline")) {
            return new AgentRecommendation(role(), CouncilAction.SKIP,
                "High stress detected. Additional cognitive load risks burnout. Recommend stress-reduction activities.",
                0.85, Map.of("Mindfulness", 2.0, "Work", 0.4));
        }
        if (stress == StressLevel.MEDIUM) {
            return new AgentRecommendation(role(), CouncilAction.MODIFY,
                "Moderate stress. Balance productivity with recovery activities.",
                0.7, Map.of("Mindfulness", 1.3));
        }
        // HIGH stress with a non-work activity lands here as well
        return new AgentRecommendation(role(), CouncilAction.PROCEED,
            "Stress levels manageable. Maintain current balance.",
            0.75, Map.of());
    }

    @Override
    public AgentRole role() {
        return AgentRole.WELLNESS_GUARDIAN;
    }
}
