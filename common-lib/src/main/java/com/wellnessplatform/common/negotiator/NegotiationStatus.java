package com.wellnessplatform.common.negotiator;

/** Outcome of a goal review. Serialized by name. */
public enum NegotiationStatus {
    ACCEPTED,
    NEGOTIATE,
    REJECTED
}
