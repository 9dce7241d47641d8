package com.wellnessplatform.decision.service;

import com.wellnessplatform.common.model.UserProfile;
import com.wellnessplatform.decision.repository.HealthDataRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final HealthDataRepository repository;

    public ProfileService(HealthDataRepository repository) {
        this.repository = repository;
    }

    public Mono<UserProfile> current() {
        return Mono.fromCallable(repository::profile);
    }

    public Mono<UserProfile> update(UserProfile profile) {
        return Mono.fromCallable(() -> {
            repository.saveProfile(profile);
            log.info("[Profile] Updated. userId={} goal={}", profile.userId(), profile.goal());
            return profile;
        });
    }
}
