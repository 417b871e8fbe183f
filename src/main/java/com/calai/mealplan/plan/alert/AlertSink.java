package com.calai.mealplan.plan.alert;

import java.util.Map;

/**
 * 告警出口（fire-and-forget）。實作不可以讓 pipeline 因為告警失敗而中斷。
 */
public interface AlertSink {

    void emit(AlertEvent event);

    default void emit(AlertLevel level, AlertType type, String traceId, Map<String, Object> payload) {
        emit(AlertEvent.of(level, type, traceId, payload));
    }
}
