package com.calai.mealplan.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 每個 item 的計算結果：一旦產生就不可變。
 * 任何失敗都降級成 0 macros + errorCode，不讓 NaN 往上傳。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MacroResult(
        double kcal,
        double protein,
        double fat,
        double carbs,
        double gramsAsSold,
        boolean flagged,
        NutritionSource source,
        Double deviationPct,
        Severity severity,
        double absorbedOilGrams,
        MacroErrorCode errorCode
) {

    public static MacroResult zero(MacroErrorCode errorCode, double gramsAsSold) {
        double g = Double.isFinite(gramsAsSold) && gramsAsSold > 0 ? gramsAsSold : 0.0;
        return new MacroResult(0, 0, 0, 0, g, false, null, null, Severity.VALID, 0, errorCode);
    }

    public static MacroResult of(double kcal, double protein, double fat, double carbs,
                                 double gramsAsSold, NutritionSource source) {
        return new MacroResult(kcal, protein, fat, carbs, gramsAsSold, false, source, null, Severity.VALID, 0, null);
    }

    public MacroResult asFlagged(Severity sev, double deviation) {
        return new MacroResult(kcal, protein, fat, carbs, gramsAsSold, true, source, deviation, sev, absorbedOilGrams, errorCode);
    }

    /** 吸油量併入 fat，kcal 以 9 kcal/g 加上去 */
    public MacroResult withAbsorbedOil(double oilGrams) {
        if (!(oilGrams > 0) || !Double.isFinite(oilGrams)) return this;
        double f = Math.round((fat + oilGrams) * 10.0) / 10.0;
        double k = Math.round(kcal + oilGrams * 9.0);
        return new MacroResult(k, protein, f, carbs, gramsAsSold, flagged, source, deviationPct, severity, oilGrams, errorCode);
    }

    /** 油 item 被其他 item 吸走一部分後，剩下的比例 */
    public MacroResult scaledBy(double ratio) {
        if (!Double.isFinite(ratio) || ratio < 0 || ratio == 1.0) return this;
        return new MacroResult(
                Math.round(kcal * ratio),
                Math.round(protein * ratio * 10.0) / 10.0,
                Math.round(fat * ratio * 10.0) / 10.0,
                Math.round(carbs * ratio * 10.0) / 10.0,
                gramsAsSold, flagged, source, deviationPct, severity, absorbedOilGrams, errorCode);
    }

    public boolean hasError() {
        return errorCode != null;
    }

    /** protein×4 ≥ max(carbs×4, fat×9) */
    public boolean isProteinDominant() {
        return protein * 4.0 >= Math.max(carbs * 4.0, fat * 9.0) && protein > 0;
    }
}
