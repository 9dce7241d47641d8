package com.wellnessplatform.common.tradeoff;

import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.PlannedTask;

/**
 * Result of one category rule before the priority boost is applied.
 * {@code adjustedTask} is only non-null for {@link DecisionAction#DOWNGRADE}.
 */
record RuleOutcome(DecisionAction action, PlannedTask adjustedTask, String reasoning) {

    static RuleOutcome of(DecisionAction action, String reasoning) {
        return new RuleOutcome(action, null, reasoning);
    }

    static RuleOutcome downgrade(PlannedTask replacement, String reasoning) {
        return new RuleOutcome(DecisionAction.DOWNGRADE, replacement, reasoning);
    }
}
