package com.calai.mealplan.plan.model;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW,
    /** 沒有任何依據：視同未解析 */
    NONE
}
