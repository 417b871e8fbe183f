package com.calai.mealplan.plan.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 依 key 子字串做分類的「有序規則表」：由上往下第一條命中的規則勝出。
 * 用表格而不是 if/else 串，讓每張表都能單獨測。
 */
public final class KeyRules<T> {

    public record Rule<T>(String id, Predicate<String> predicate, T value) {
    }

    private final List<Rule<T>> rules;

    private KeyRules(List<Rule<T>> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /** key 會先轉小寫再比對 */
    public Optional<Rule<T>> firstMatch(String key) {
        String k = lower(key);
        for (Rule<T> r : rules) {
            if (r.predicate().test(k)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public T valueOr(String key, T fallback) {
        return firstMatch(key).map(Rule::value).orElse(fallback);
    }

    public List<Rule<T>> rules() {
        return rules;
    }

    public static String lower(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT).trim();
    }

    // ===== predicate helpers =====

    public static Predicate<String> containsAny(String... words) {
        return k -> {
            for (String w : words) {
                if (k.contains(w)) return true;
            }
            return false;
        };
    }

    public static Predicate<String> matches(String regex) {
        Pattern p = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return k -> p.matcher(k).find();
    }

    /** 以非字母切 token，任一 token 完全相等 */
    public static Predicate<String> hasWord(String... words) {
        return k -> {
            for (String t : k.split("[^a-z]+")) {
                for (String w : words) {
                    if (t.equals(w)) return true;
                }
            }
            return false;
        };
    }

    public static final class Builder<T> {
        private final List<Rule<T>> rules = new ArrayList<>();

        public Builder<T> rule(String id, Predicate<String> predicate, T value) {
            rules.add(new Rule<>(id, predicate, value));
            return this;
        }

        public KeyRules<T> build() {
            return new KeyRules<>(rules);
        }
    }
}
