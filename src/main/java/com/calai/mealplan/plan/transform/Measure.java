package com.calai.mealplan.plan.transform;

public enum Measure {
    GRAMS,
    MILLILITRES
}
