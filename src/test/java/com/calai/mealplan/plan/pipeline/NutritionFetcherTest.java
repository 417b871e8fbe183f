package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.alert.AlertEvent;
import com.calai.mealplan.plan.alert.AlertLevel;
import com.calai.mealplan.plan.alert.AlertType;
import com.calai.mealplan.plan.alert.ProgressListener;
import com.calai.mealplan.plan.error.NutritionLookupException;
import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.NutritionRecord;
import com.calai.mealplan.plan.model.NutritionSource;
import com.calai.mealplan.plan.nutrition.NutritionLookup;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NutritionFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final NutritionLookup lookup = mock(NutritionLookup.class);
    private final List<AlertEvent> alerts = new ArrayList<>();
    private final NutritionFetcher fetcher = new NutritionFetcher(lookup, Runnable::run, alerts::add);

    private static NutritionRecord rec(NutritionSource source) {
        return new NutritionRecord(100, 10, 2, 10, source, Confidence.HIGH);
    }

    @Test
    void found_and_missing_keys_are_counted() {
        when(lookup.lookup("chicken_breast")).thenReturn(rec(NutritionSource.HOTPATH));
        when(lookup.lookup("rice")).thenReturn(rec(NutritionSource.CANONICAL));
        when(lookup.lookup("dragonfruit")).thenReturn(null);
        ProgressListener listener = mock(ProgressListener.class);

        NutritionFetcher.Outcome out = fetcher.fetchAll(List.of("chicken_breast", "rice", "dragonfruit"), TIMEOUT, "t-1", listener);

        assertThat(out.records()).containsOnlyKeys("chicken_breast", "rice");
        assertThat(out.stats().uniqueKeys()).isEqualTo(3);
        assertThat(out.stats().hotpath()).isEqualTo(1);
        assertThat(out.stats().canonical()).isEqualTo(1);
        assertThat(out.stats().missing()).isEqualTo(1);
        assertThat(out.stats().fallbackRatePct()).isZero();
        assertThat(alerts).isEmpty();
        verify(listener).onIngredientFound("chicken_breast", NutritionSource.HOTPATH);
        verify(listener).onIngredientFailed("dragonfruit", "NOT_FOUND");
    }

    @Test
    void one_failing_key_does_not_fail_the_batch() {
        when(lookup.lookup("chicken_breast")).thenReturn(rec(NutritionSource.HOTPATH));
        when(lookup.lookup("rice")).thenThrow(new NutritionLookupException("rice", "upstream 503", null));

        NutritionFetcher.Outcome out = fetcher.fetchAll(List.of("chicken_breast", "rice"), TIMEOUT, "t-2", null);

        assertThat(out.records()).containsOnlyKeys("chicken_breast");
        assertThat(out.stats().failed()).isEqualTo(1);
        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.type()).isEqualTo(AlertType.NUTRITION_LOOKUP_FAILED);
            assertThat(a.payload()).containsEntry("key", "rice").containsEntry("error", "upstream 503");
        });
    }

    @Test
    void high_fallback_rate_is_critical() {
        when(lookup.lookup("chicken_breast")).thenReturn(rec(NutritionSource.HOTPATH));
        when(lookup.lookup("chicken_drumstick")).thenReturn(rec(NutritionSource.FALLBACK));

        NutritionFetcher.Outcome out = fetcher.fetchAll(List.of("chicken_breast", "chicken_drumstick"), TIMEOUT, "t-3", null);

        assertThat(out.stats().fallbackRatePct()).isEqualTo(50.0);
        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.level()).isEqualTo(AlertLevel.CRITICAL);
            assertThat(a.type()).isEqualTo(AlertType.HIGH_FALLBACK_RATE);
        });
    }

    @Test
    void elevated_fallback_rate_is_warning() {
        when(lookup.lookup(anyString())).thenReturn(rec(NutritionSource.HOTPATH));
        when(lookup.lookup("e")).thenReturn(rec(NutritionSource.FALLBACK));

        NutritionFetcher.Outcome out = fetcher.fetchAll(List.of("a", "b", "c", "d", "e"), TIMEOUT, "t-4", null);

        assertThat(out.stats().fallbackRatePct()).isEqualTo(20.0);
        assertThat(alerts).extracting(AlertEvent::type).containsExactly(AlertType.ELEVATED_FALLBACK_RATE);
    }

    @Test
    void slow_lookup_times_out_as_failed() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            NutritionLookup slow = key -> {
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return rec(NutritionSource.HOTPATH);
            };
            NutritionFetcher f = new NutritionFetcher(slow, pool, alerts::add);

            NutritionFetcher.Outcome out = f.fetchAll(List.of("rice"), Duration.ofMillis(50), "t-5", null);

            assertThat(out.records()).isEmpty();
            assertThat(out.stats().failed()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void saturated_executor_counts_rejected_keys_as_failed() {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(1);
        pool.initialize();
        try {
            NutritionLookup slow = key -> {
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return rec(NutritionSource.HOTPATH);
            };
            NutritionFetcher f = new NutritionFetcher(slow, pool, alerts::add);

            NutritionFetcher.Outcome out = f.fetchAll(List.of("a", "b", "c", "d"), TIMEOUT, "t-6", null);

            // 1 個在跑、1 個排隊，其他兩個被拒
            assertThat(out.records()).containsOnlyKeys("a", "b");
            assertThat(out.stats().hotpath()).isEqualTo(2);
            assertThat(out.stats().failed()).isEqualTo(2);
            assertThat(alerts).extracting(AlertEvent::type)
                    .containsOnly(AlertType.NUTRITION_LOOKUP_FAILED)
                    .hasSize(2);
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void record_without_source_counts_as_fallback() {
        when(lookup.lookup("chicken_breast")).thenReturn(rec(NutritionSource.HOTPATH));
        when(lookup.lookup("mystery_meat")).thenReturn(rec(null));
        ProgressListener listener = mock(ProgressListener.class);

        NutritionFetcher.Outcome out = fetcher.fetchAll(List.of("chicken_breast", "mystery_meat"), TIMEOUT, "t-7", listener);

        assertThat(out.records()).containsOnlyKeys("chicken_breast", "mystery_meat");
        assertThat(out.records().get("mystery_meat").source()).isEqualTo(NutritionSource.FALLBACK);
        assertThat(out.stats().fallback()).isEqualTo(1);
        assertThat(out.stats().failed()).isZero();
        verify(listener).onIngredientFound("mystery_meat", NutritionSource.FALLBACK);
    }
}
