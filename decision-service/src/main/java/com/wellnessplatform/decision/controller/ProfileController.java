package com.wellnessplatform.decision.controller;

import com.wellnessplatform.common.model.UserProfile;
import com.wellnessplatform.decision.service.ProfileService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/profile")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public Mono<ResponseEntity<UserProfile>> current() {
        return profileService.current().map(ResponseEntity::ok);
    }

    @PutMapping
    public Mono<ResponseEntity<UserProfile>> update(@RequestBody UserProfile profile) {
        if (profile.userId() == null || profile.userId().isBlank()) {
            return Mono.error(new IllegalArgumentException("userId is required"));
        }
        return profileService.update(profile).map(ResponseEntity::ok);
    }
}
