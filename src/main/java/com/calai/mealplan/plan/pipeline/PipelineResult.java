package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.PlannedMeal;

import java.util.List;

public record PipelineResult(
        String traceId,
        List<PlannedMeal> meals,
        MacroTotals dayTotals,
        MacroTargets targets,
        PlanValidationReport validation,
        List<Correction> corrections,
        PipelineTrace trace
) {
    public PipelineResult {
        meals = (meals == null) ? List.of() : List.copyOf(meals);
        corrections = (corrections == null) ? List.of() : List.copyOf(corrections);
    }
}
