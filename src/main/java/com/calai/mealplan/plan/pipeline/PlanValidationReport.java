package com.calai.mealplan.plan.pipeline;

import java.util.List;

/**
 * valid = 沒有任何 critical
 */
public record PlanValidationReport(
        boolean valid,
        List<ValidationIssue> critical,
        List<ValidationIssue> warnings,
        List<ValidationIssue> info
) {

    public PlanValidationReport {
        critical = (critical == null) ? List.of() : List.copyOf(critical);
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
        info = (info == null) ? List.of() : List.copyOf(info);
    }

    public static PlanValidationReport of(List<ValidationIssue> issues) {
        List<ValidationIssue> c = issues.stream().filter(i -> i.level() == ValidationIssue.Level.CRITICAL).toList();
        List<ValidationIssue> w = issues.stream().filter(i -> i.level() == ValidationIssue.Level.WARNING).toList();
        List<ValidationIssue> n = issues.stream().filter(i -> i.level() == ValidationIssue.Level.INFO).toList();
        return new PlanValidationReport(c.isEmpty(), c, w, n);
    }

    public boolean hasCode(String code) {
        return critical.stream().anyMatch(i -> i.code().equals(code))
                || warnings.stream().anyMatch(i -> i.code().equals(code))
                || info.stream().anyMatch(i -> i.code().equals(code));
    }
}
