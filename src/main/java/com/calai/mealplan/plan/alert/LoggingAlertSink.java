package com.calai.mealplan.plan.alert;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 預設告警實作：寫 log。
 * - CRITICAL 一律輸出
 * - WARNING / INFO 同一個 type 在 window 內最多輸出 maxPerWindow 次（避免洗版）
 */
@Slf4j
@Component
public class LoggingAlertSink implements AlertSink {

    private final Cache<AlertType, AtomicInteger> recent;
    private final int maxPerWindow;

    public LoggingAlertSink(@Value("${app.mealplan.alert.rate-limit-window:PT1M}") Duration window,
                            @Value("${app.mealplan.alert.max-per-window:5}") int maxPerWindow) {
        this.maxPerWindow = Math.max(1, maxPerWindow);
        this.recent = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(AlertType.values().length * 2L)
                .build();
    }

    @Override
    public void emit(AlertEvent event) {
        if (event == null) return;
        if (!shouldEmit(event)) {
            log.debug("alert_suppressed type={} level={} traceId={}", event.type(), event.level(), safe(event.traceId()));
            return;
        }

        switch (event.level()) {
            case CRITICAL -> log.error("alert level=CRITICAL type={} id={} traceId={} payload={}",
                    event.type(), event.id(), safe(event.traceId()), event.payload());
            case WARNING -> log.warn("alert level=WARNING type={} id={} traceId={} payload={}",
                    event.type(), event.id(), safe(event.traceId()), event.payload());
            case INFO -> log.info("alert level=INFO type={} id={} traceId={} payload={}",
                    event.type(), event.id(), safe(event.traceId()), event.payload());
        }
    }

    boolean shouldEmit(AlertEvent event) {
        if (event.level() == AlertLevel.CRITICAL) return true;
        // ✅ window 從該 type 第一次出現開始算（expireAfterWrite 只看建立的那次寫入）
        AtomicInteger count = recent.get(event.type(), t -> new AtomicInteger());
        return count.incrementAndGet() <= maxPerWindow;
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "NA" : s; }
}
