package com.calai.mealplan.plan.model;

public record PlannedItem(Item item, MacroResult macros) {
}
