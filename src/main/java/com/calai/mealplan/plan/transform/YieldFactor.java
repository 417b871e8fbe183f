package com.calai.mealplan.plan.transform;

/**
 * mapped=false：沒有對應分類，用 1:1 預設值
 */
public record YieldFactor(String category, double factor, FactorType type, boolean mapped) {
}
