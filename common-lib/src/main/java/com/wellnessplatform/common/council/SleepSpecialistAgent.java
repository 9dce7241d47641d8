package com.wellnessplatform.common.council;

import java.util.Locale;
import java.util.Map;

/** Guards recovery and circadian health; vetoes hard sessions after short nights. */
public final class SleepSpecialistAgent implements CouncilAgent {

    private static final double CRITICAL_SLEEP = 6.0;
    private static final double ADEQUATE_SLEEP = 7.0;

    @Override
    public AgentRecommendation recommend(CouncilContext context) {
        double sleep = context.state().sleepHours();

        if (sleep < CRITICAL_SLEEP && context.activityMentions("hiit", "intense")) {
            return new AgentRecommendation(role(), CouncilAction.SKIP,
                String.format(Locale.ROOT,
                    "Sleep debt detected (%.1fh). High-intensity exercise increases cortisol and impairs recovery.",
                    sleep),
                0.95, Map.of("Sleep", 2.0, "Exercise", 0.3));
        }
        if (sleep < ADEQUATE_SLEEP) {
            return new AgentRecommendation(role(), CouncilAction.MODIFY,
                String.format(Locale.ROOT,
                    "Suboptimal sleep (%.1fh). Recommend lower intensity to preserve recovery capacity.", sleep),
                0.75, Map.of("Sleep", 1.5, "Exercise", 0.7));
        }
        return new AgentRecommendation(role(), CouncilAction.PROCEED,
            String.format(Locale.ROOT, "Adequate sleep (%.1fh). Recovery capacity is good.", sleep),
            0.8, Map.of());
    }

    @Override
    public AgentRole role() {
        return AgentRole.SLEEP_SPECIALIST;
    }
}
