package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.model.Severity;

import java.util.List;

/**
 * soft mode 的彙總結果
 */
public record InvariantReport(boolean passed, List<Violation> violations) {

    public InvariantReport {
        violations = (violations == null) ? List.of() : List.copyOf(violations);
    }

    public static InvariantReport of(List<Violation> violations) {
        return new InvariantReport(violations == null || violations.isEmpty(), violations);
    }

    public boolean hasCritical() {
        return violations.stream().anyMatch(v -> v.severity() == Severity.CRITICAL);
    }
}
