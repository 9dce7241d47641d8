package com.wellnessplatform.decision.repository;

import com.wellnessplatform.common.model.AdaptationRecord;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.DomainPreferences;
import com.wellnessplatform.common.model.TradeOffDecision;
import com.wellnessplatform.common.model.UserProfile;
import com.wellnessplatform.decision.TestDecisions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryHealthDataRepositoryTest {

    @Test
    @DisplayName("history is bounded: the oldest entries are dropped first")
    void boundedHistory() {
        InMemoryHealthDataRepository repository = new InMemoryHealthDataRepository(50);
        for (int i = 0; i < 60; i++) {
            repository.append(TestDecisions.decision("d" + i, 0, DecisionAction.MAINTAIN));
        }

        List<TradeOffDecision> history = repository.history();
        assertEquals(50, history.size());
        assertEquals("d10", history.get(0).decisionId());
        assertEquals("d59", repository.latest().orElseThrow().decisionId());
    }

    @Test
    @DisplayName("concurrent appends never exceed the bound")
    void concurrentAppends() throws Exception {
        InMemoryHealthDataRepository repository = new InMemoryHealthDataRepository(50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        for (int i = 0; i < 200; i++) {
            String id = "c" + i;
            pool.submit(() -> {
                repository.append(TestDecisions.decision(id, 0, DecisionAction.MAINTAIN));
                done.countDown();
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(50, repository.history().size());
    }

    @Test
    @DisplayName("returned history is a snapshot, clear empties the log")
    void snapshotAndClear() {
        InMemoryHealthDataRepository repository = new InMemoryHealthDataRepository(50);
        repository.append(TestDecisions.decision("a", 0, DecisionAction.SKIP));
        List<TradeOffDecision> snapshot = repository.history();

        repository.clearHistory();

        assertEquals(1, snapshot.size());
        assertTrue(repository.history().isEmpty());
        assertTrue(repository.latest().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
    }

    @Test
    @DisplayName("profile defaults to the demo user and can be replaced; adaptations accumulate")
    void profileAndAdaptations() {
        InMemoryHealthDataRepository repository = new InMemoryHealthDataRepository(50);
        assertEquals("default", repository.profile().userId());

        repository.saveProfile(new UserProfile("u1", "Sam", "Sleep better", DomainPreferences.balanced()));
        assertEquals("Sleep better", repository.profile().goal());

        repository.appendAdaptations(List.of(new AdaptationRecord(TestDecisions.NOW, "chronic_high_stress",
            "reduced", List.of(Category.FITNESS), "stress")));
        repository.appendAdaptations(List.of());
        assertEquals(1, repository.adaptations().size());
    }
}
