package com.wellnessplatform.decision.repository;

import com.wellnessplatform.common.model.AdaptationRecord;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link HealthDataRepository}. Writes are serialized by one lock;
 * reads return copies so callers never observe a half-trimmed list.
 */
@Repository
public class InMemoryHealthDataRepository implements HealthDataRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHealthDataRepository.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TradeOffDecision> history = new ArrayList<>();
    private final List<AdaptationRecord> adaptations = new ArrayList<>();
    private final int maxSize;
    private UserProfile profile = UserProfile.defaultProfile();

    public InMemoryHealthDataRepository(@Value("${engine.history.max-size:50}") int maxSize) {
        this.maxSize = Math.max(1, maxSize);
    }

    @Override
    public List<TradeOffDecision> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TradeOffDecision> latest() {
        lock.lock();
        try {
            return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(TradeOffDecision decision) {
        lock.lock();
        try {
            history.add(decision);
            int overflow = history.size() - maxSize;
            if (overflow > 0) {
                history.subList(0, overflow).clear();
                log.debug("[Repository] History trimmed. dropped={} size={}", overflow, history.size());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearHistory() {
        lock.lock();
        try {
            history.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int maxHistorySize() {
        return maxSize;
    }

    @Override
    public UserProfile profile() {
        lock.lock();
        try {
            return profile;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveProfile(UserProfile newProfile) {
        lock.lock();
        try {
            profile = newProfile;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AdaptationRecord> adaptations() {
        lock.lock();
        try {
            return List.copyOf(adaptations);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendAdaptations(List<AdaptationRecord> records) {
        lock.lock();
        try {
            adaptations.addAll(records);
        } finally {
            lock.unlock();
        }
    }
}
