package com.wellnessplatform.common.council;

import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.util.List;
import java.util.Locale;

/**
 * Read-only input shared by all council agents for one deliberation.
 * History is ordered oldest first.
 */
public record CouncilContext(
    StateSnapshot state,
    String activity,
    String goal,
    List<TradeOffDecision> history
) {
    public CouncilContext {
        activity = activity != null ? activity : "";
        goal     = goal != null && !goal.isBlank() ? goal : "Improve overall health";
        history  = history != null ? List.copyOf(history) : List.of();
    }

    /** Case-insensitive keyword test against the planned activity. */
    public boolean activityMentions(String... keywords) {
        String lower = activity.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (lower.contains(k.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
