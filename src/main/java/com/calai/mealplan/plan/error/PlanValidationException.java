package com.calai.mealplan.plan.error;

import com.calai.mealplan.plan.pipeline.PlanValidationReport;

import java.util.Map;
import java.util.stream.Collectors;

public class PlanValidationException extends PipelineException {

    public static final String CODE = "PLAN_VALIDATION_FAILED";

    private final PlanValidationReport report;

    public PlanValidationException(PlanValidationReport report, String traceId, String stage) {
        super(CODE,
                "Critical validation issues: " + report.critical().stream()
                        .map(i -> i.message())
                        .collect(Collectors.joining("; ")),
                traceId, stage,
                Map.of("criticalCount", report.critical().size()),
                null);
        this.report = report;
    }

    public PlanValidationReport report() { return report; }
}
