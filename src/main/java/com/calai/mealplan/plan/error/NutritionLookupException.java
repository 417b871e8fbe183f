package com.calai.mealplan.plan.error;

/**
 * 外部 nutrition lookup 失敗；fetcher 逐 key 接住，不會中斷整個 run
 */
public class NutritionLookupException extends RuntimeException {

    private final String normalizedKey;

    public NutritionLookupException(String normalizedKey, String message, Throwable cause) {
        super(message, cause);
        this.normalizedKey = normalizedKey;
    }

    public String normalizedKey() { return normalizedKey; }
}
