package com.calai.mealplan.plan.nutrition;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

@Configuration
@EnableCaching
public class NutritionCacheConfig {

    public static final String CACHE_NAME = "nutritionRecord";

    @Bean("nutritionCacheManager")
    @Primary
    public CacheManager nutritionCacheManager(
            @Value("${app.mealplan.nutrition.cache.ttl:PT6H}") Duration ttl,
            @Value("${app.mealplan.nutrition.cache.max-size:10000}") long maxSize
    ) {
        CaffeineCacheManager mgr = new CaffeineCacheManager(CACHE_NAME);
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
        );
        return mgr;
    }
}
