package com.calai.mealplan.plan.nutrition;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * ✅ 啟動自檢：catalog 有讀到東西才算 UP
 */
@Component
public class NutritionCatalogHealthIndicator implements HealthIndicator {

    private final NutritionCatalog catalog;

    public NutritionCatalogHealthIndicator(NutritionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        Health.Builder b = catalog.size() > 0
                ? Health.up()
                : Health.down().withDetail("reason", "NUTRITION_CATALOG_EMPTY");

        return b.withDetail("location", catalog.location())
                .withDetail("entries", catalog.size())
                .withDetail("fallbacks", catalog.fallbacks().size())
                .build();
    }
}
