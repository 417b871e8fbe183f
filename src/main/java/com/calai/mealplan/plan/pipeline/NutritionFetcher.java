package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.alert.AlertLevel;
import com.calai.mealplan.plan.alert.AlertSink;
import com.calai.mealplan.plan.alert.AlertType;
import com.calai.mealplan.plan.alert.ProgressListener;
import com.calai.mealplan.plan.model.NutritionRecord;
import com.calai.mealplan.plan.model.NutritionSource;
import com.calai.mealplan.plan.nutrition.NutritionLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * FETCH-NUTRITION：每個 unique key 一個 lookup，全部丟到 executor 上，等全部回來。
 * 單一 key 失敗 / 逾時 → 當作查不到（null），不中斷整個 run。
 */
@Slf4j
@Component
public class NutritionFetcher {

    public static final double HIGH_FALLBACK_RATE_PCT = 30.0;
    public static final double ELEVATED_FALLBACK_RATE_PCT = 15.0;

    public record Outcome(Map<String, NutritionRecord> records, FetchStats stats) {
    }

    private final NutritionLookup lookup;
    private final Executor executor;
    private final AlertSink alerts;

    public NutritionFetcher(NutritionLookup lookup,
                            @Qualifier("nutritionLookupExecutor") Executor executor,
                            AlertSink alerts) {
        this.lookup = lookup;
        this.executor = executor;
        this.alerts = alerts;
    }

    public Outcome fetchAll(Collection<String> normalizedKeys, Duration timeout, String traceId, ProgressListener listener) {
        ProgressListener l = listener == null ? ProgressListener.NOOP : listener;
        List<String> keys = new ArrayList<>(normalizedKeys);
        long timeoutMs = Math.max(1, timeout.toMillis());

        List<CompletableFuture<NutritionRecord>> futures = new ArrayList<>(keys.size());
        for (String key : keys) {
            CompletableFuture<NutritionRecord> f;
            try {
                f = CompletableFuture
                        .supplyAsync(() -> lookup.lookup(key), executor)
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // pool 滿了：這個 key 算 failed，不中斷整個 run
                f = CompletableFuture.failedFuture(e);
            }
            futures.add(f);
        }

        Map<String, NutritionRecord> records = new LinkedHashMap<>();
        int hotpath = 0, canonical = 0, fallback = 0, missing = 0, failed = 0;

        // 結果以 key 對應，完成順序不重要
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            NutritionRecord r;
            NutritionSource source;
            try {
                r = futures.get(i).join();
                // source 沒帶：當作 fallback 等級
                source = (r == null || r.source() == null) ? NutritionSource.FALLBACK : r.source();
            } catch (RuntimeException e) {
                failed++;
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("nutrition_lookup_failed traceId={} key={} error={}", traceId, key, cause.toString());
                alerts.emit(AlertLevel.WARNING, AlertType.NUTRITION_LOOKUP_FAILED, traceId,
                        Map.of("key", key, "error", String.valueOf(cause.getMessage())));
                l.onIngredientFailed(key, cause.getClass().getSimpleName());
                continue;
            }

            if (r == null) {
                missing++;
                log.info("nutrition_not_found traceId={} key={}", traceId, key);
                l.onIngredientFailed(key, "NOT_FOUND");
                continue;
            }

            if (r.source() == null) {
                r = new NutritionRecord(r.calories(), r.protein(), r.fat(), r.carbs(), source, r.confidence());
            }
            records.put(key, r);
            switch (source) {
                case HOTPATH -> hotpath++;
                case CANONICAL -> canonical++;
                case FALLBACK -> fallback++;
            }
            l.onIngredientFound(key, source);
        }

        int found = hotpath + canonical + fallback;
        double fallbackRate = found == 0 ? 0.0 : fallback * 100.0 / found;
        FetchStats stats = new FetchStats(keys.size(), hotpath, canonical, fallback, missing, failed, round1(fallbackRate));

        log.info("nutrition_fetch_done traceId={} keys={} hotpath={} canonical={} fallback={} missing={} failed={} fallbackRatePct={}",
                traceId, keys.size(), hotpath, canonical, fallback, missing, failed, stats.fallbackRatePct());

        emitFallbackRateAlert(stats, traceId);
        return new Outcome(Collections.unmodifiableMap(records), stats);
    }

    private void emitFallbackRateAlert(FetchStats stats, String traceId) {
        double rate = stats.fallbackRatePct();
        if (rate <= ELEVATED_FALLBACK_RATE_PCT) return;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("fallbackRatePct", rate);
        payload.put("fallback", stats.fallback());
        payload.put("found", stats.found());

        if (rate > HIGH_FALLBACK_RATE_PCT) {
            alerts.emit(AlertLevel.CRITICAL, AlertType.HIGH_FALLBACK_RATE, traceId, payload);
        } else {
            alerts.emit(AlertLevel.WARNING, AlertType.ELEVATED_FALLBACK_RATE, traceId, payload);
        }
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
