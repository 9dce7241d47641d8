package com.wellnessplatform.common.negotiator;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screens free-text goals for unsafe targets before they become the user's stated goal.
 *
 * <h3>Rules, first match wins</h3>
 * <ol>
 *   <li>Weight change: "lose|gain N kg|lbs ... in M day|week|month". A weekly rate above
 *       {@value #MAX_LOSS_KG_PER_WEEK} kg (loss) or {@value #MAX_GAIN_KG_PER_WEEK} kg (gain)
 *       is NEGOTIATE with a longer timeline aimed at 80% of the limit.</li>
 *   <li>Sleep restriction ("sleep less", "4 hours") is REJECTED.</li>
 *   <li>Daily training ("every day" with run, gym or train) is NEGOTIATE at 5 days/week.</li>
 *   <li>Anything else is ACCEPTED.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class GoalNegotiator {

    static final double MAX_LOSS_KG_PER_WEEK = 1.0;
    static final double MAX_GAIN_KG_PER_WEEK = 0.5;
    static final double TARGET_RATE_SHARE    = 0.8;
    static final double KG_PER_LB            = 0.45;
    static final int    WEEKS_PER_MONTH      = 4;

    private static final Pattern WEIGHT   = Pattern.compile("(lose|gain) (\\d+)\\s*(kg|lbs)");
    private static final Pattern DURATION = Pattern.compile("in (\\d+)\\s*(day|week|month)");
    private static final Pattern EVERY_DAY = Pattern.compile("(?i)every day");

    public NegotiationResult evaluate(String goal) {
        String text  = goal != null ? goal.trim() : "";
        String lower = text.toLowerCase(Locale.ROOT);

        NegotiationResult weight = checkWeightRate(lower);
        if (weight != null) return weight;

        if (lower.contains("sleep less") || lower.contains("4 hours")) {
            return new NegotiationResult(NegotiationStatus.REJECTED,
                "Optimize deep sleep quality (8h total)",
                "Cutting sleep below baseline impairs recovery and cognition; this goal cannot be supported.",
                0.1);
        }

        if (lower.contains("every day")
                && (lower.contains("run") || lower.contains("gym") || lower.contains("train"))) {
            return new NegotiationResult(NegotiationStatus.NEGOTIATE,
                EVERY_DAY.matcher(text).replaceAll("5 days/week"),
                "Training every day leads to overtraining; 5 days/week leaves room for adaptation.",
                0.6);
        }

        return new NegotiationResult(NegotiationStatus.ACCEPTED, null,
            "This goal appears ambitious yet sustainable given your current profile.", 0.95);
    }

    private NegotiationResult checkWeightRate(String lower) {
        Matcher weight = WEIGHT.matcher(lower);
        Matcher duration = DURATION.matcher(lower);
        if (!weight.find() || !duration.find()) return null;

        String direction = weight.group(1);
        int amount = Integer.parseInt(weight.group(2));
        String unit = weight.group(3);
        int length = Integer.parseInt(duration.group(1));
        String period = duration.group(2);

        double kg = "kg".equals(unit) ? amount : amount * KG_PER_LB;
        double weeks = switch (period) {
            case "day"  -> length / 7.0;
            case "week" -> length;
            default     -> (double) length * WEEKS_PER_MONTH;
        };
        double rate = weeks > 0 ? kg / weeks : Double.POSITIVE_INFINITY;

        boolean losing = "lose".equals(direction);
        double limit = losing ? MAX_LOSS_KG_PER_WEEK : MAX_GAIN_KG_PER_WEEK;
        if (rate <= limit) return null;

        int recommendedWeeks = (int) (kg / (limit * TARGET_RATE_SHARE));
        String counter = String.format(Locale.ROOT, "%s %d%s in %d weeks",
            losing ? "Lose" : "Gain", amount, unit, recommendedWeeks);
        String reasoning = Double.isInfinite(rate)
            ? String.format(Locale.ROOT, "A zero-length timeline is not achievable. Safe limit is ~%.1fkg/week.", limit)
            : String.format(Locale.ROOT, "Your goal implies %s %.1fkg/week. Safe limit is ~%.1fkg/week.",
                losing ? "losing" : "gaining", rate, limit);
        return new NegotiationResult(NegotiationStatus.NEGOTIATE, counter, reasoning, 0.4);
    }
}
