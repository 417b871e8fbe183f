package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.ItemState;

/**
 * yieldFactor 只有 cooked 才會有值；valid=false 時 gramsAsSold=0
 */
public record AsSoldResult(
        double gramsAsSold,
        ItemState resolvedState,
        CookingMethod resolvedMethod,
        YieldFactor yieldFactor,
        boolean stateInferred,
        boolean valid
) {

    public static AsSoldResult invalid(ItemState state, CookingMethod method) {
        return new AsSoldResult(0.0, state, method, null, false, false);
    }

    public Double yieldFactorValue() {
        return yieldFactor == null ? null : yieldFactor.factor();
    }
}
