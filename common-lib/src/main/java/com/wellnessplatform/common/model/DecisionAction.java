package com.wellnessplatform.common.model;

/**
 * Per-category outcome of a trade-off cycle.
 *
 * <ul>
 *   <li>{@link #PRIORITIZE} : full execution, ahead of other categories</li>
 *   <li>{@link #MAINTAIN}  : execute as planned</li>
 *   <li>{@link #DOWNGRADE} : execute a reduced replacement task</li>
 *   <li>{@link #DEFER}     : move to a later slot</li>
 *   <li>{@link #SKIP}      : drop for today</li>
 * </ul>
 */
public enum DecisionAction {
    PRIORITIZE,
    MAINTAIN,
    DOWNGRADE,
    DEFER,
    SKIP;

    /** True for the two actions that count as a reduction in pattern and risk statistics. */
    public boolean isReduction() {
        return this == DOWNGRADE || this == SKIP;
    }
}
