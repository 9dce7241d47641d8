package com.wellnessplatform.decision.repository;

import com.wellnessplatform.common.model.AdaptationRecord;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Storage capability for decision history, the user profile and the adaptation log.
 *
 * <p>History is append-only, ordered oldest first and bounded: after every append only
 * the most recent {@link #maxHistorySize()} entries are kept.
 */
public interface HealthDataRepository {

    List<TradeOffDecision> history();

    Optional<TradeOffDecision> latest();

    void append(TradeOffDecision decision);

    void clearHistory();

    int maxHistorySize();

    UserProfile profile();

    void saveProfile(UserProfile profile);

    List<AdaptationRecord> adaptations();

    void appendAdaptations(List<AdaptationRecord> records);
}
