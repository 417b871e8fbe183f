package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.error.PipelineException;
import com.calai.mealplan.plan.model.Severity;

public class InvariantViolationException extends PipelineException {

    public static final String CODE = "INVARIANT_VIOLATION";

    private final Violation violation;

    public InvariantViolationException(Violation violation) {
        this(violation, null, null);
    }

    public InvariantViolationException(Violation violation, String traceId, String stage) {
        super(CODE, violation.message(), traceId, stage, violation.context(), null);
        this.violation = violation;
    }

    public Violation violation() { return violation; }
    public InvariantId invariantId() { return violation.invariantId(); }
    public Severity severity() { return violation.severity(); }
}
