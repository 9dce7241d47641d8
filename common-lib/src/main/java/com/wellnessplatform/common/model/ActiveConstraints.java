package com.wellnessplatform.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered set of active constraints keyed by {@link ConstraintType}.
 *
 * <p>Built by the constraint evaluator during a single pass and read-only afterwards.
 * Adding the same type twice within one pass replaces the earlier entry.
 */
public final class ActiveConstraints {

    private final Map<ConstraintType, Constraint> byType = new LinkedHashMap<>();

    public static ActiveConstraints none() {
        return new ActiveConstraints();
    }

    public static ActiveConstraints of(Constraint... constraints) {
        ActiveConstraints active = new ActiveConstraints();
        for (Constraint c : constraints) {
            active.add(c);
        }
        return active;
    }

    public void add(Constraint constraint) {
        byType.put(constraint.type(), constraint);
    }

    public void add(ConstraintType type, double severity, String description, String source) {
        add(new Constraint(type, severity, description, source));
    }

    public boolean has(ConstraintType type) {
        return byType.containsKey(type);
    }

    public boolean hasAny(ConstraintType... types) {
        for (ConstraintType t : types) {
            if (byType.containsKey(t)) return true;
        }
        return false;
    }

    /** Severity of the given constraint, or 0.0 when it is not active. */
    public double severityOf(ConstraintType type) {
        Constraint c = byType.get(type);
        return c != null ? c.severity() : 0.0;
    }

    public boolean isEmpty() {
        return byType.isEmpty();
    }

    public int size() {
        return byType.size();
    }

    public List<Constraint> asList() {
        return Collections.unmodifiableList(new ArrayList<>(byType.values()));
    }

    public List<ConstraintType> names() {
        return List.copyOf(byType.keySet());
    }

    public Set<ConstraintType> types() {
        return byType.isEmpty() ? EnumSet.noneOf(ConstraintType.class) : EnumSet.copyOf(byType.keySet());
    }

    public double meanSeverity() {
        return byType.values().stream()
            .mapToDouble(Constraint::severity)
            .average()
            .orElse(0.0);
    }

    @Override
    public String toString() {
        return "ActiveConstraints" + byType.keySet();
    }
}
