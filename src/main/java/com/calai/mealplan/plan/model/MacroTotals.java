package com.calai.mealplan.plan.model;

public record MacroTotals(double kcal, double protein, double fat, double carbs) {

    public static final MacroTotals ZERO = new MacroTotals(0, 0, 0, 0);

    public MacroTotals plus(MacroResult m) {
        if (m == null) return this;
        return new MacroTotals(kcal + m.kcal(), protein + m.protein(), fat + m.fat(), carbs + m.carbs());
    }

    public MacroTotals plus(MacroTotals o) {
        if (o == null) return this;
        return new MacroTotals(kcal + o.kcal, protein + o.protein, fat + o.fat, carbs + o.carbs);
    }

    /** kcal 取整數、macros 取一位小數 */
    public MacroTotals rounded() {
        return new MacroTotals(Math.round(kcal), round1(protein), round1(fat), round1(carbs));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
