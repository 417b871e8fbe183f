package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.PlannedItem;
import com.calai.mealplan.plan.model.PlannedMeal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 出貨前最後一道防線：所有數字一定是有限值（否則 0），meal 一定有 items，totals 用修過的值重算。
 * 跟前面的 guard 各自獨立，不假設前面一定做對。
 */
@Component
public class PlanSanitizer {

    public record Sanitized(List<PlannedMeal> meals, SanitizationStats stats) {
    }

    public Sanitized sanitize(List<PlannedMeal> meals) {
        int[] coerced = {0};
        int patched = 0;
        List<PlannedMeal> out = new ArrayList<>();

        if (meals == null) return new Sanitized(out, SanitizationStats.EMPTY);

        for (PlannedMeal m : meals) {
            if (m == null) {
                patched++;
                continue;
            }
            String name = m.name();
            if (name == null || name.isBlank()) {
                name = m.type() == null ? "meal" : m.type().code();
                patched++;
            }

            List<PlannedItem> items = new ArrayList<>(m.items().size());
            MacroTotals totals = MacroTotals.ZERO;
            for (PlannedItem pi : m.items()) {
                if (pi.item() == null) {
                    patched++;
                    continue;
                }
                MacroResult r = sanitizeMacros(pi.macros(), coerced);
                Item it = sanitizeItem(pi.item(), coerced);
                items.add(new PlannedItem(it, r));
                totals = totals.plus(r);
            }
            out.add(new PlannedMeal(m.type(), name, items, totals.rounded(), m.computed()));
        }
        return new Sanitized(out, new SanitizationStats(coerced[0], patched));
    }

    private static MacroResult sanitizeMacros(MacroResult r, int[] coerced) {
        if (r == null) {
            coerced[0]++;
            return MacroResult.zero(null, 0);
        }
        double kcal = finite(r.kcal(), coerced);
        double p = finite(r.protein(), coerced);
        double f = finite(r.fat(), coerced);
        double c = finite(r.carbs(), coerced);
        double g = finite(r.gramsAsSold(), coerced);
        double oil = finite(r.absorbedOilGrams(), coerced);
        Double dev = r.deviationPct();
        if (dev != null && !Double.isFinite(dev)) {
            dev = null;
            coerced[0]++;
        }
        return new MacroResult(kcal, p, f, c, g, r.flagged(), r.source(), dev, r.severity(), oil, r.errorCode());
    }

    private static Item sanitizeItem(Item it, int[] coerced) {
        Double q = it.quantityValue();
        if (q == null || !Double.isFinite(q)) {
            coerced[0]++;
            return it.withQuantityValue(0.0);
        }
        return it;
    }

    private static double finite(double v, int[] coerced) {
        if (Double.isFinite(v)) return v;
        coerced[0]++;
        return 0.0;
    }
}
