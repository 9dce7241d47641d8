package com.wellnessplatform.common.priority;

import com.wellnessplatform.common.model.ActiveConstraints;
import com.wellnessplatform.common.model.Category;
import com.wellnessplatform.common.model.Constraint;
import com.wellnessplatform.common.model.ConstraintType;
import com.wellnessplatform.common.model.DomainPreferences;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dynamic priority matrix: turns active constraints and optional user preferences into
 * a normalized category distribution.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Start from {@link #BASE_PRIORITIES} (sums to 1.0).</li>
 *   <li>For each active constraint with a modifier row, add {@code delta × severity} per category.</li>
 *   <li>If preferences are supplied: {@code p = p × 0.7 + preference × 0.3}.</li>
 *   <li>Normalize to 1.0 with every category held at or above {@value #PRIORITY_FLOOR}.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class PriorityMatrix {

    static final double PRIORITY_FLOOR    = 0.05;
    static final double COMPUTED_SHARE    = 0.7;
    static final double PREFERENCE_SHARE  = 0.3;

    /** Base distribution. Iteration order doubles as the ranking tie-break order. */
    public static final Map<Category, Double> BASE_PRIORITIES;

    /** Ranking tie-break: recovery, nutrition, fitness, mindfulness. */
    public static final List<Category> BASE_ORDER =
        List.of(Category.RECOVERY, Category.NUTRITION, Category.FITNESS, Category.MINDFULNESS);

    private static final Map<ConstraintType, Map<Category, Double>> MODIFIERS =
        new EnumMap<>(ConstraintType.class);

    static {
        Map<Category, Double> base = new EnumMap<>(Category.class);
        base.put(Category.RECOVERY,    0.30);
        base.put(Category.NUTRITION,   0.25);
        base.put(Category.FITNESS,     0.25);
        base.put(Category.MINDFULNESS, 0.20);
        BASE_PRIORITIES = Collections.unmodifiableMap(base);

        modifier(ConstraintType.CRITICAL_SLEEP,
            Category.RECOVERY, +0.25, Category.FITNESS, -0.20, Category.MINDFULNESS, +0.05);
        modifier(ConstraintType.LOW_SLEEP,
            Category.RECOVERY, +0.15, Category.FITNESS, -0.10);
        modifier(ConstraintType.HIGH_STRESS,
            Category.MINDFULNESS, +0.20, Category.FITNESS, -0.10, Category.RECOVERY, +0.10);
        modifier(ConstraintType.LOW_ENERGY,
            Category.RECOVERY, +0.10, Category.FITNESS, -0.15);
        modifier(ConstraintType.CRITICAL_ENERGY,
            Category.RECOVERY, +0.20, Category.FITNESS, -0.25, Category.MINDFULNESS, +0.10);
        modifier(ConstraintType.OVERTRAINING_RISK,
            Category.RECOVERY, +0.20, Category.FITNESS, -0.20);
        modifier(ConstraintType.BURNOUT_WARNING,
            Category.RECOVERY, +0.25, Category.FITNESS, -0.25, Category.MINDFULNESS, +0.15,
            Category.NUTRITION, -0.10);
        // A short workout still beats none
        modifier(ConstraintType.TIME_LIMITED,
            Category.FITNESS, +0.05);
        modifier(ConstraintType.TIME_CRITICAL,
            Category.NUTRITION, +0.10, Category.FITNESS, -0.15);
    }

    private static void modifier(ConstraintType type, Object... categoryDeltaPairs) {
        Map<Category, Double> row = new LinkedHashMap<>();
        for (int i = 0; i < categoryDeltaPairs.length; i += 2) {
            row.put((Category) categoryDeltaPairs[i], (Double) categoryDeltaPairs[i + 1]);
        }
        MODIFIERS.put(type, Collections.unmodifiableMap(row));
    }

    /** Modifier row for a constraint; empty for constraints that do not shift priorities. */
    public static Map<Category, Double> modifiersFor(ConstraintType type) {
        return MODIFIERS.getOrDefault(type, Map.of());
    }

    public PriorityResult calculate(ActiveConstraints constraints) {
        return calculate(constraints, null);
    }

    /**
     * @param constraints active constraints for this cycle
     * @param preferences optional user preferences; {@code null} skips the blend step
     */
    public PriorityResult calculate(ActiveConstraints constraints, DomainPreferences preferences) {
        Map<Category, Double> priorities = new EnumMap<>(BASE_PRIORITIES);
        Map<String, String> adjustments = new LinkedHashMap<>();

        for (Constraint constraint : constraints.asList()) {
            Map<Category, Double> row = MODIFIERS.get(constraint.type());
            if (row == null) continue;

            for (Map.Entry<Category, Double> entry : row.entrySet()) {
                double scaled = entry.getValue() * constraint.severity();
                priorities.merge(entry.getKey(), scaled, Double::sum);

                String sign = scaled > 0 ? "+" : "";
                adjustments.put(entry.getKey().wireName() + "_" + constraint.type().wireName(),
                    String.format(Locale.ROOT, "%s%.2f (%s)", sign, scaled, constraint.type().wireName()));
            }
        }

        if (preferences != null) {
            for (Category category : Category.values()) {
                double blended = priorities.get(category) * COMPUTED_SHARE
                               + preferences.valueFor(category) * PREFERENCE_SHARE;
                priorities.put(category, blended);
            }
        }

        return new PriorityResult(normalizeWithFloor(priorities), adjustments);
    }

    /**
     * Pins every category below {@value #PRIORITY_FLOOR} at the floor and spreads the
     * remaining mass over the others in proportion, repeating until no free category
     * falls under the floor. The result sums to 1.0.
     */
    static Map<Category, Double> normalizeWithFloor(Map<Category, Double> raw) {
        Map<Category, Double> result = new EnumMap<>(Category.class);
        Set<Category> pinned = EnumSet.noneOf(Category.class);
        for (Category category : Category.values()) {
            if (raw.getOrDefault(category, 0.0) < PRIORITY_FLOOR) pinned.add(category);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            double freeMass = 1.0 - PRIORITY_FLOOR * pinned.size();
            double freeTotal = 0.0;
            for (Category category : Category.values()) {
                if (!pinned.contains(category)) freeTotal += raw.get(category);
            }
            if (freeTotal <= 0.0) {
                // every category pinned: nothing left to weigh, split evenly
                for (Category category : Category.values()) {
                    result.put(category, 1.0 / Category.values().length);
                }
                return result;
            }
            for (Category category : Category.values()) {
                if (pinned.contains(category)) {
                    result.put(category, PRIORITY_FLOOR);
                    continue;
                }
                double share = raw.get(category) / freeTotal * freeMass;
                if (share < PRIORITY_FLOOR) {
                    pinned.add(category);
                    changed = true;
                }
                result.put(category, share);
            }
        }
        return result;
    }
}
