package com.calai.mealplan.plan.nutrition;

import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.NutritionRecord;
import com.calai.mealplan.plan.model.NutritionSource;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 先查完全符合的 key；沒有就用 token fallback（source=FALLBACK、confidence=LOW）。
 * 查不到回 null，不進 cache（下次 catalog 有更新才查得到）。
 */
@Service
public class CatalogNutritionLookup implements NutritionLookup {

    private final NutritionCatalog catalog;

    public CatalogNutritionLookup(NutritionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    @Cacheable(
            cacheNames = NutritionCacheConfig.CACHE_NAME,
            cacheManager = "nutritionCacheManager",
            unless = "#result == null"
    )
    public NutritionRecord lookup(String normalizedKey) {
        if (normalizedKey == null || normalizedKey.isBlank()) return null;

        NutritionRecord exact = catalog.get(normalizedKey);
        if (exact != null) return exact;

        Set<String> tokens = new HashSet<>(Arrays.asList(normalizedKey.split("_")));
        for (NutritionCatalog.Fallback fb : catalog.fallbacks()) {
            if (!tokens.contains(fb.token())) continue;
            NutritionRecord ref = catalog.get(fb.ref());
            if (ref == null) continue;
            return new NutritionRecord(ref.calories(), ref.protein(), ref.fat(), ref.carbs(),
                    NutritionSource.FALLBACK, Confidence.LOW);
        }
        return null;
    }
}
