package com.calai.mealplan.plan.dto;

import com.calai.mealplan.plan.model.MacroTargets;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record MacroTargetsRequest(
        @NotNull(message = "Calories is required") @DecimalMin(value = "0", message = "Calories must not be negative") Double kcal,
        @NotNull(message = "Protein is required")  @DecimalMin(value = "0", message = "Protein must not be negative") Double protein,
        @DecimalMin(value = "0", message = "Fat must not be negative") Double fat,
        @DecimalMin(value = "0", message = "Carbs must not be negative") Double carbs
) {
    public MacroTargets toTargets() {
        return new MacroTargets(kcal, protein, fat, carbs);
    }
}
