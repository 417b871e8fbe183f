package com.calai.mealplan.plan.model;

import java.util.List;

public record DayPlan(List<PlannedMeal> meals, MacroTotals dayTotals, MacroTargets targets) {

    public DayPlan {
        meals = (meals == null) ? List.of() : List.copyOf(meals);
        dayTotals = (dayTotals == null) ? MacroTotals.ZERO : dayTotals;
    }
}
