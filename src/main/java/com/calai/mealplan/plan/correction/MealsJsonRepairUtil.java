package com.calai.mealplan.plan.correction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * generator 回來的文字常見問題：
 * 1) 前後有說明文字 / ```json fence
 * 2) 被截斷：尾巴卡在 ,"  或  :
 * 3) number 卡在 140.（JSON 不合法）
 * 4) 括號沒收齊、多一個逗號
 * 修得回來就回 meals array，修不回來回 null。
 */
@Slf4j
public final class MealsJsonRepairUtil {

    private MealsJsonRepairUtil() {}

    public static JsonNode repairOrNull(ObjectMapper om, String rawText) {
        if (rawText == null || rawText.isBlank()) return null;

        String payload = extractFirstJsonPayload(rawText);
        if (payload == null) return null;

        payload = sanitizeDanglingTail(payload);
        payload = fixDanglingNumberDot(payload);
        payload = balanceJsonIfNeeded(payload);
        payload = removeTrailingCommas(payload);

        JsonNode parsed;
        try {
            parsed = om.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("meals_json_unrepairable len={} reason={}", rawText.length(), e.getOriginalMessage());
            return null;
        }

        if (parsed == null) return null;
        if (parsed.isArray()) return parsed;

        // { "meals": [...] } → 解開
        if (parsed.isObject() && parsed.path("meals").isArray()) {
            return parsed.get("meals");
        }
        return null;
    }

    /** 尾巴卡在 "key": → 補 null；卡在 ,"ke → 整段砍掉 */
    static String sanitizeDanglingTail(String s) {
        String t = rtrim(s);
        if (t.endsWith(":")) return t + "null";

        t = t.replaceFirst(",\\s*\"[^\"]*$", "");
        t = t.replaceFirst(",\\s*$", "");
        return t;
    }

    /** 只修「結尾」的 140. */
    static String fixDanglingNumberDot(String s) {
        return s.replaceFirst("(\\d+)\\.$", "$1.0");
    }

    static String removeTrailingCommas(String s) {
        return s.replaceAll(",\\s*([}\\]])", "$1");
    }

    /**
     * 依「開啟順序」反向補上 ] / }（meals 是 array 套 object，順序不能亂）
     */
    static String balanceJsonIfNeeded(String s) {
        StringBuilder stack = new StringBuilder();
        boolean inStr = false, esc = false;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inStr) {
                if (esc) { esc = false; continue; }
                if (c == '\\') { esc = true; continue; }
                if (c == '"') inStr = false;
                continue;
            }
            if (c == '"') { inStr = true; continue; }
            if (c == '{' || c == '[') stack.append(c);
            else if ((c == '}' || c == ']') && stack.length() > 0) stack.setLength(stack.length() - 1);
        }

        StringBuilder sb = new StringBuilder(s);
        // 字串被截斷在中間：先把引號收掉
        if (inStr) sb.append('"');
        for (int i = stack.length() - 1; i >= 0; i--) {
            sb.append(stack.charAt(i) == '{' ? '}' : ']');
        }
        return sb.toString();
    }

    /**
     * 從第一個 [ 或 { 開始，抓到對應的結尾；沒有結尾就整段回傳（交給 balance）
     */
    static String extractFirstJsonPayload(String text) {
        int arr = text.indexOf('[');
        int obj = text.indexOf('{');
        int start;
        if (arr < 0) start = obj;
        else if (obj < 0) start = arr;
        else start = Math.min(arr, obj);
        if (start < 0) return null;

        boolean inStr = false, esc = false;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inStr) {
                if (esc) { esc = false; continue; }
                if (c == '\\') { esc = true; continue; }
                if (c == '"') inStr = false;
                continue;
            }
            if (c == '"') { inStr = true; continue; }
            if (c == '{' || c == '[') depth++;
            else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) return text.substring(start, i + 1);
            }
        }
        return text.substring(start);
    }

    private static String rtrim(String s) {
        int i = s.length();
        while (i > 0 && Character.isWhitespace(s.charAt(i - 1))) i--;
        return s.substring(0, i);
    }
}
