package com.wellnessplatform.common.council;

import com.wellnessplatform.common.HistoryFixtures;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.StateSnapshot;
import com.wellnessplatform.common.model.StressLevel;
import com.wellnessplatform.common.model.TradeOffDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.wellnessplatform.common.HistoryFixtures.decision;
import static com.wellnessplatform.common.HistoryFixtures.entry;
import static org.junit.jupiter.api.Assertions.*;

class HealthCouncilTest {

    private final HealthCouncil council = new HealthCouncil();

    private static CouncilContext context(StateSnapshot state, String activity) {
        return new CouncilContext(state, activity, null, List.of());
    }

    // ── Agents ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("individual agents")
    class AgentTests {

        @Test
        @DisplayName("sleep specialist vetoes HIIT after a short night, case-insensitively")
        void sleepSpecialist_vetoesHiit() {
            AgentRecommendation vote = new SleepSpecialistAgent()
                .recommend(context(StateSnapshot.of(5.5, 8, StressLevel.LOW, 2.0), "hiit intervals"));
            assertEquals(CouncilAction.SKIP, vote.action());
            assertEquals(0.95, vote.confidence(), 1e-9);
            assertTrue(vote.reasoning().startsWith("Sleep debt detected (5.5h)"));
        }

        @Test
        @DisplayName("sleep specialist asks to modify after 6.5h")
        void sleepSpecialist_modify() {
            AgentRecommendation vote = new SleepSpecialistAgent()
                .recommend(context(StateSnapshot.of(6.5, 8, StressLevel.LOW, 2.0), "Yoga"));
            assertEquals(CouncilAction.MODIFY, vote.action());
        }

        @Test
        @DisplayName("performance coach proceeds on high energy when the activity is exercise, quoting the goal")
        void coach_highEnergy() {
            AgentRecommendation vote = new PerformanceCoachAgent().recommend(new CouncilContext(
                StateSnapshot.of(8.0, 8, StressLevel.LOW, 2.0), "Exercise: tempo run", "Run a marathon", List.of()));
            assertEquals(CouncilAction.PROCEED, vote.action());
            assertTrue(vote.reasoning().endsWith("aligned with goal: Run a marathon"));
        }

        @Test
        @DisplayName("performance coach recommends rest at energy 3")
        void coach_lowEnergy() {
            AgentRecommendation vote = new PerformanceCoachAgent()
                .recommend(context(StateSnapshot.of(8.0, 3, StressLevel.LOW, 2.0), "Reading"));
            assertEquals(CouncilAction.MODIFY, vote.action());
            assertEquals(0.7, vote.confidence(), 1e-9);
        }

        @Test
        @DisplayName("wellness guardian skips deadline work under high stress, proceeds otherwise")
        void guardian() {
            StateSnapshot stressed = StateSnapshot.of(8.0, 6, StressLevel.HIGH, 2.0);
            assertEquals(CouncilAction.SKIP,
                new WellnessGuardianAgent().recommend(context(stressed, "Deadline push")).action());
            assertEquals(CouncilAction.PROCEED,
                new WellnessGuardianAgent().recommend(context(stressed, "Yoga")).action());
        }

        @Test
        @DisplayName("future self pushes to proceed when more than half of the last 7 entries had a skip")
        void futureSelf_highSkipRate() {
            List<TradeOffDecision> history = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                DecisionAction action = i < 4 ? DecisionAction.SKIP : DecisionAction.MAINTAIN;
                history.add(entry(HistoryFixtures.daysAgo(7 - i), HistoryFixtures.rested(), List.of(),
                    decision(Category.FITNESS, action)));
            }
            AgentRecommendation vote = new FutureSelfAgent().recommend(
                new CouncilContext(HistoryFixtures.rested(), "Run", null, history));

            assertEquals(CouncilAction.PROCEED, vote.action());
            assertEquals(0.9, vote.confidence(), 1e-9);
            assertTrue(vote.reasoning().startsWith("Skip rate is 57% this week."));
        }

        @Test
        @DisplayName("only the 7 most recent entries count toward the skip rate")
        void futureSelf_window() {
            List<TradeOffDecision> history = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                DecisionAction action = i < 3 ? DecisionAction.SKIP : DecisionAction.MAINTAIN;
                history.add(entry(HistoryFixtures.daysAgo(10 - i), HistoryFixtures.rested(), List.of(),
                    decision(Category.FITNESS, action)));
            }
            assertEquals(0.0, FutureSelfAgent.recentSkipRate(history), 1e-9);
        }
    }

    // ── Deliberation ───────────────────────────────────────────────

    @Nested
    @DisplayName("deliberate()")
    class DeliberateTests {

        @Test
        @DisplayName("short night before HIIT → proceed wins 2.15 to 0.95, sleep specialist dissents")
        void hiitAfterShortNight() {
            ConsensusDecision result = council.deliberate(
                StateSnapshot.of(5.5, 8, StressLevel.HIGH, 2.0), "HIIT session", null, List.of());

            assertEquals(CouncilAction.PROCEED, result.finalAction());
            assertEquals(2.15 / 3.1, result.consensusLevel(), 1e-9);
            assertEquals(4, result.votes().size());
            assertEquals(1, result.dissentingOpinions().size());
            assertTrue(result.dissentingOpinions().get(0).startsWith("sleep: Sleep debt detected"));
        }

        @Test
        @DisplayName("one vote per seat, in role order")
        void oneVotePerSeat() {
            ConsensusDecision result = council.deliberate(HistoryFixtures.rested(), "Walk", "Stay active", null);
            assertEquals(List.of(AgentRole.SLEEP_SPECIALIST, AgentRole.PERFORMANCE_COACH,
                    AgentRole.WELLNESS_GUARDIAN, AgentRole.FUTURE_SELF),
                result.votes().stream().map(AgentRecommendation::role).collect(Collectors.toList()));
        }
    }
}
