package com.calai.mealplan.plan.alert;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AlertEvent(
        String id,
        Instant timestamp,
        AlertLevel level,
        AlertType type,
        String traceId,
        Map<String, Object> payload
) {

    public static AlertEvent of(AlertLevel level, AlertType type, String traceId, Map<String, Object> payload) {
        return new AlertEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                level,
                type,
                traceId,
                payload == null ? Map.of() : payload
        );
    }
}
