package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.model.UserProfile;
import com.wellnessplatform.common.negotiator.GoalNegotiator;
import com.wellnessplatform.common.negotiator.NegotiationResult;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/** Screens a proposed goal; an accepted goal replaces the one on the stored profile. */
@Service
public class NegotiationService {

    private static final Logger log = LoggerFactory.getLogger(NegotiationService.class);

    private final GoalNegotiator negotiator;
    private final HealthDataRepository repository;

    public NegotiationService(GoalNegotiator negotiator, HealthDataRepository repository) {
        this.negotiator = negotiator;
        this.repository = repository;
    }

    public Mono<NegotiationResult> negotiate(String goal) {
        return Mono.fromCallable(() -> {
            NegotiationResult result = negotiator.evaluate(goal);
            if (result.accepted()) {
                UserProfile profile = repository.profile();
                repository.saveProfile(new UserProfile(profile.userId(), profile.name(), goal.trim(),
                    profile.preferences()));
            }
            log.info("[Negotiator] Goal reviewed. status={} safetyScore={} goalSaved={}",
                     result.status(), result.safetyScore(), result.accepted());
            return result;
        });
    }
}
