package com.wellnessplatform.common.council;

/** What a council agent recommends doing with the planned activity. */
public enum CouncilAction {
    PROCEED,
    MODIFY,
    SKIP
}
