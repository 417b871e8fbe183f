package com.calai.mealplan.plan.nutrition;

import com.calai.mealplan.plan.model.NutritionRecord;

/**
 * 每 100 g 營養值的外部查詢。
 * 查不到回 null；真的壞掉（IO、上游錯）才丟 {@link com.calai.mealplan.plan.error.NutritionLookupException}。
 * 必須 idempotent，pipeline 可能同時對不同 key 呼叫。
 */
public interface NutritionLookup {

    NutritionRecord lookup(String normalizedKey);
}
