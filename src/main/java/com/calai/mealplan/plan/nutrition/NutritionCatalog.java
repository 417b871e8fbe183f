package com.calai.mealplan.plan.nutrition;

import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.NutritionRecord;
import com.calai.mealplan.plan.model.NutritionSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * classpath 上的營養表（JSON）。啟動時讀一次，之後唯讀。
 *
 * <pre>
 * { "entries":   [ { "key": "chicken_breast", "source": "hotpath", "calories": 120, ... } ],
 *   "fallbacks": [ { "token": "chicken", "ref": "chicken_breast" } ] }
 * </pre>
 */
@Slf4j
@Component
public class NutritionCatalog {

    public record Fallback(String token, String ref) {
    }

    private final Map<String, NutritionRecord> entries;
    private final List<Fallback> fallbacks;
    private final String location;

    public NutritionCatalog(
            ObjectMapper om,
            ResourceLoader resourceLoader,
            @Value("${app.mealplan.nutrition.catalog:classpath:nutrition/catalog.json}") String location
    ) {
        this.location = location;
        Resource res = resourceLoader.getResource(location);
        try (InputStream in = res.getInputStream()) {
            JsonNode root = om.readTree(in);
            this.entries = Collections.unmodifiableMap(parseEntries(root.path("entries")));
            this.fallbacks = List.copyOf(parseFallbacks(root.path("fallbacks")));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load nutrition catalog: " + location, e);
        }
        log.info("nutrition_catalog_loaded location={} entries={} fallbacks={}", location, entries.size(), fallbacks.size());
    }

    public NutritionRecord get(String key) {
        return key == null ? null : entries.get(key);
    }

    public List<Fallback> fallbacks() {
        return fallbacks;
    }

    public int size() {
        return entries.size();
    }

    public String location() {
        return location;
    }

    private static Map<String, NutritionRecord> parseEntries(JsonNode arr) {
        Map<String, NutritionRecord> out = new LinkedHashMap<>();
        if (arr == null || !arr.isArray()) return out;

        for (JsonNode n : arr) {
            String key = n.path("key").asText("").trim();
            if (key.isEmpty()) continue;

            NutritionSource source = "hotpath".equals(n.path("source").asText("").toLowerCase(Locale.ROOT))
                    ? NutritionSource.HOTPATH
                    : NutritionSource.CANONICAL;
            Confidence confidence = source == NutritionSource.HOTPATH ? Confidence.HIGH : Confidence.MEDIUM;

            out.put(key, new NutritionRecord(
                    n.path("calories").asDouble(0),
                    n.path("protein").asDouble(0),
                    n.path("fat").asDouble(0),
                    n.path("carbs").asDouble(0),
                    source,
                    confidence
            ));
        }
        return out;
    }

    private static List<Fallback> parseFallbacks(JsonNode arr) {
        List<Fallback> out = new ArrayList<>();
        if (arr == null || !arr.isArray()) return out;
        for (JsonNode n : arr) {
            String token = n.path("token").asText("").trim();
            String ref = n.path("ref").asText("").trim();
            if (!token.isEmpty() && !ref.isEmpty()) out.add(new Fallback(token, ref));
        }
        return out;
    }
}
