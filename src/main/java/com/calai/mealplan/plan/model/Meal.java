package com.calai.mealplan.plan.model;

import java.util.List;

public record Meal(MealType type, String name, List<Item> items) {

    public Meal {
        items = (items == null) ? List.of() : List.copyOf(items);
    }

    public Meal withItems(List<Item> newItems) {
        return new Meal(type, name, newItems);
    }

    public boolean hasItems() {
        return !items.isEmpty();
    }
}
