package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.model.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Violation(
        InvariantId invariantId,
        String message,
        Map<String, Object> context,
        Severity severity,
        Instant timestamp
) {

    public Violation {
        // 允許 null value（例如 quantityValue 缺值），所以不用 Map.copyOf
        context = (context == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        timestamp = (timestamp == null) ? Instant.now() : timestamp;
    }

    public static Violation of(InvariantId id, Severity severity, String message, Map<String, Object> context) {
        return new Violation(id, message, context, severity, Instant.now());
    }
}
