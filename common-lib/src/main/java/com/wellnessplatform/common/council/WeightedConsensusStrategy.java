package com.wellnessplatform.common.council;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default {@link ConsensusEngine}: confidence-weighted majority.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Sort votes into {@link AgentRole} declaration order.</li>
 *   <li>Sum confidences per action (insertion-ordered).</li>
 *   <li>Highest sum wins; on an exact tie the action seen first keeps the lead.</li>
 *   <li>{@code consensusLevel = winnerSum / totalSum}, 0.0 when the total is 0.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public class WeightedConsensusStrategy implements ConsensusEngine {

    @Override
    public ConsensusDecision compute(List<AgentRecommendation> votes) {
        List<AgentRecommendation> ordered = new ArrayList<>(votes);
        ordered.sort(Comparator.comparing(AgentRecommendation::role));

        if (ordered.isEmpty()) {
            return new ConsensusDecision(CouncilAction.PROCEED, 0.0, List.of(),
                "Council Decision (0% consensus): PROCEED", List.of());
        }

        Map<CouncilAction, Double> totals = new LinkedHashMap<>();
        for (AgentRecommendation vote : ordered) {
            totals.merge(vote.action(), vote.confidence(), Double::sum);
        }

        CouncilAction winner = null;
        double winnerSum = -1.0;
        for (Map.Entry<CouncilAction, Double> e : totals.entrySet()) {
            if (e.getValue() > winnerSum) {
                winner    = e.getKey();
                winnerSum = e.getValue();
            }
        }

        double total = totals.values().stream().mapToDouble(Double::doubleValue).sum();
        double level = total > 0.0 ? winnerSum / total : 0.0;

        final CouncilAction finalAction = winner;
        List<String> dissent = ordered.stream()
            .filter(v -> v.action() != finalAction)
            .map(v -> v.role().wireName() + ": " + v.reasoning())
            .collect(Collectors.toList());

        String summary = String.format(Locale.ROOT, "Council Decision (%.0f%% consensus): %s", level * 100, finalAction)
            + ordered.stream()
                .filter(v -> v.action() == finalAction)
                .map(v -> "\n• " + v.role().wireName() + ": " + v.reasoning())
                .collect(Collectors.joining());

        return new ConsensusDecision(finalAction, level, ordered, summary, dissent);
    }
}
