package com.wellnessplatform.common.tradeoff;

import com.wellnessplatform.common.model.DecisionAction;
import com.wellnessplatform.common.model.DomainDecision;
import com.wellnessplatform.common.model.FutureImpact;
import com.wellnessplatform.common.model.TradeOffDecision;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of a {@link TradeOffDecision}, one marker per action:
 * ✓ prioritize, • maintain, ↓ downgrade, → defer, ✗ skip.
 */
public final class DecisionTextRenderer {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private DecisionTextRenderer() {}

    public static String marker(DecisionAction action) {
        return switch (action) {
            case PRIORITIZE -> "✓";
            case MAINTAIN   -> "•";
            case DOWNGRADE  -> "↓";
            case DEFER      -> "→";
            case SKIP       -> "✗";
        };
    }

    public static String render(TradeOffDecision decision, ZoneId zone) {
        List<String> lines = new ArrayList<>();
        lines.add("Decision " + decision.decisionId() + " at "
            + TIMESTAMP.format(decision.timestamp().atZone(zone)));

        String constraints = decision.constraintsActive().stream()
            .map(Object::toString)
            .collect(Collectors.joining(", "));
        lines.add("Active Constraints: " + (constraints.isEmpty() ? "None" : constraints));
        lines.add("");
        lines.add("Decisions:");

        for (DomainDecision d : decision.decisions()) {
            String category = d.category().wireName().toUpperCase(Locale.ROOT);
            String original = d.originalTask().name();
            String line = switch (d.action()) {
                case DOWNGRADE -> original + " → " + d.adjustedTask().name();
                case SKIP      -> "Skip " + original;
                default        -> original;
            };
            lines.add("  " + marker(d.action()) + " " + category + ": " + line);
            lines.add("      Reason: " + d.reasoning());
        }

        if (!decision.futureImpacts().isEmpty()) {
            lines.add("");
            lines.add("Future Adjustments:");
            for (FutureImpact impact : decision.futureImpacts()) {
                lines.add("  • " + impact.description());
            }
        }
        return String.join("\n", lines);
    }
}
