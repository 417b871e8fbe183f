package com.calai.mealplan.plan.dto;

import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.PlannedItem;
import com.calai.mealplan.plan.model.PlannedMeal;
import com.calai.mealplan.plan.pipeline.PipelineResult;
import com.calai.mealplan.plan.pipeline.PipelineTrace;
import com.calai.mealplan.plan.pipeline.PlanValidationReport;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MealPlanResponse(
        String traceId,
        List<MealView> meals,
        MacroTotals dayTotals,
        MacroTargets targets,
        PlanValidationReport validation,
        List<Correction> corrections,
        PipelineTrace trace
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MealView(String type, String name, boolean computed, List<ItemView> items, MacroTotals totals) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemView(String key, Double quantityValue, String quantityUnit,
                           String stateHint, String methodHint, MacroResult macros) {}

    public static MealPlanResponse from(PipelineResult r) {
        List<MealView> meals = r.meals().stream().map(MealPlanResponse::toView).toList();
        return new MealPlanResponse(r.traceId(), meals, r.dayTotals(), r.targets(),
                r.validation(), r.corrections(), r.trace());
    }

    private static MealView toView(PlannedMeal m) {
        List<ItemView> items = m.items().stream().map(MealPlanResponse::toView).toList();
        return new MealView(m.type() == null ? null : m.type().code(), m.name(), m.computed(), items, m.totals());
    }

    private static ItemView toView(PlannedItem pi) {
        Item it = pi.item();
        return new ItemView(
                it.key(),
                it.quantityValue(),
                it.quantityUnit(),
                it.stateHint() == null ? null : it.stateHint().code(),
                it.methodHint() == null ? null : it.methodHint().code(),
                pi.macros()
        );
    }
}
