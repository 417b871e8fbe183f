package com.calai.mealplan.plan.model;

/**
 * 宣告順序即嚴重度順序（compareTo 可直接比大小）
 */
public enum Severity {
    VALID,
    WARNING,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
