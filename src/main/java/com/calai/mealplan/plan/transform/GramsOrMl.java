package com.calai.mealplan.plan.transform;

/**
 * valid=false 時 value 一律是 0（不會是 NaN）
 */
public record GramsOrMl(double value, Measure measure, boolean valid, String note) {

    public static GramsOrMl invalid(String note) {
        return new GramsOrMl(0.0, Measure.GRAMS, false, note);
    }

    public static GramsOrMl grams(double v, String note) {
        return new GramsOrMl(v, Measure.GRAMS, true, note);
    }

    public static GramsOrMl millilitres(double v, String note) {
        return new GramsOrMl(v, Measure.MILLILITRES, true, note);
    }
}
