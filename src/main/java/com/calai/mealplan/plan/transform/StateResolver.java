package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.StateResolution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 用 key 決定食材的 state（dry / raw / cooked / as_pack）。
 * 1) key 含烹調字（cooked / fried / baked ...）→ cooked，HIGH
 * 2) 規則表依 priority 由小到大，第一條命中勝出
 *    - 100~199 複合品項（fried rice、rice paper、peanut butter…）：HIGH
 *    - 200~899 單一食材：MEDIUM
 * 3) catch-all → as_pack，LOW
 * key 空白 → confidence NONE（視同未解析）
 */
public final class StateResolver {

    private StateResolver() {}

    public record Rule(String id, Pattern pattern, String category, ItemState state,
                       CookingMethod method, int priority, Confidence confidence) {
    }

    private record CookingKeyword(String keyword, CookingMethod method, Pattern pattern) {
    }

    private static final List<CookingKeyword> COOKING_KEYWORDS = List.of(
            kw("hard-boiled", CookingMethod.BOILED),
            kw("soft-boiled", CookingMethod.BOILED),
            kw("pan-fried", CookingMethod.FRIED),
            kw("pan fried", CookingMethod.FRIED),
            kw("stir-fried", CookingMethod.FRIED),
            kw("stir fried", CookingMethod.FRIED),
            kw("deep-fried", CookingMethod.FRIED),
            kw("deep fried", CookingMethod.FRIED),
            kw("cooked", null),
            kw("fried", CookingMethod.FRIED),
            kw("baked", CookingMethod.BAKED),
            kw("steamed", CookingMethod.STEAMED),
            kw("boiled", CookingMethod.BOILED),
            kw("grilled", CookingMethod.GRILLED),
            kw("roasted", CookingMethod.ROASTED),
            kw("sauteed", CookingMethod.SAUTEED),
            kw("sautéed", CookingMethod.SAUTEED),
            kw("poached", CookingMethod.POACHED),
            kw("braised", CookingMethod.BRAISED),
            kw("toasted", CookingMethod.BAKED),
            kw("charred", CookingMethod.GRILLED),
            kw("caramelized", CookingMethod.SAUTEED),
            kw("scrambled", CookingMethod.FRIED)
    );

    private static final List<Rule> RULES;

    static {
        List<Rule> r = new ArrayList<>();

        // ===== 100-199：複合品項（子字串比對會誤判的） =====
        r.add(hi("COMPOUND_FRIED_RICE", "fried\\s*rice", "PREPARED", ItemState.COOKED, CookingMethod.FRIED, 100));
        r.add(hi("COMPOUND_RICE_PAPER", "rice\\s*paper", "PACKAGED", ItemState.AS_PACK, null, 101));
        r.add(hi("COMPOUND_RICE_NOODLES", "rice\\s*noodle", "GRAINS", ItemState.DRY, null, 102));
        r.add(hi("COMPOUND_RICE_CRACKER", "rice\\s*cracker", "PACKAGED", ItemState.AS_PACK, null, 103));
        r.add(hi("COMPOUND_RICE_CAKE", "rice\\s*cake", "PACKAGED", ItemState.AS_PACK, null, 104));
        r.add(hi("COMPOUND_RICE_PUDDING", "rice\\s*pudding", "PREPARED", ItemState.COOKED, null, 105));
        r.add(hi("COMPOUND_RICE_MILK", "rice\\s*milk", "BEVERAGES", ItemState.AS_PACK, null, 106));
        r.add(hi("COMPOUND_GOAT_CHEESE", "goat'?s?\\s*cheese", "DAIRY", ItemState.AS_PACK, null, 110));
        r.add(hi("COMPOUND_GOAT_MILK", "goat'?s?\\s*milk", "DAIRY", ItemState.AS_PACK, null, 111));
        r.add(hi("COMPOUND_OAT_MILK", "oat\\s*milk", "BEVERAGES", ItemState.AS_PACK, null, 112));
        r.add(hi("COMPOUND_PEANUT_BUTTER", "peanut\\s*butter", "NUTS_SEEDS", ItemState.AS_PACK, null, 115));
        r.add(hi("COMPOUND_ALMOND_BUTTER", "almond\\s*butter", "NUTS_SEEDS", ItemState.AS_PACK, null, 116));
        r.add(hi("COMPOUND_COCONUT_MILK", "coconut\\s*milk", "PACKAGED", ItemState.AS_PACK, null, 117));
        r.add(hi("COMPOUND_COCONUT_CREAM", "coconut\\s*cream", "PACKAGED", ItemState.AS_PACK, null, 118));
        r.add(hi("COMPOUND_COCONUT_OIL", "coconut\\s*oil", "CONDIMENTS", ItemState.AS_PACK, null, 119));
        r.add(hi("COMPOUND_OLIVE_OIL", "olive\\s*oil", "CONDIMENTS", ItemState.AS_PACK, null, 120));
        r.add(hi("COMPOUND_EGG_WHITE", "egg\\s*white", "PROTEINS", ItemState.RAW, null, 125));
        r.add(hi("COMPOUND_EGG_YOLK", "egg\\s*yolk", "PROTEINS", ItemState.RAW, null, 126));
        r.add(hi("COMPOUND_CANNED_BEANS", "(canned|tinned)\\s*\\w*\\s*(beans|chickpeas|lentils)", "PACKAGED", ItemState.AS_PACK, null, 130));
        r.add(hi("COMPOUND_CANNED_TUNA", "(canned|tinned)\\s*tuna|tuna\\s*in\\s*(oil|water|brine)", "PACKAGED", ItemState.AS_PACK, null, 131));
        r.add(hi("COMPOUND_CANNED_SALMON", "(canned|tinned)\\s*salmon", "PACKAGED", ItemState.AS_PACK, null, 132));
        r.add(hi("COMPOUND_TOMATO_PASTE", "tomato\\s*paste", "CONDIMENTS", ItemState.AS_PACK, null, 135));
        r.add(hi("COMPOUND_TOMATO_SAUCE", "tomato\\s*sauce|passata", "CONDIMENTS", ItemState.AS_PACK, null, 136));
        r.add(hi("COMPOUND_MINCED_MEAT", "mince|ground\\s*(beef|pork|turkey|chicken|lamb)", "PROTEINS", ItemState.RAW, null, 140));
        r.add(hi("COMPOUND_SMOKED_SALMON", "smoked\\s*salmon", "PACKAGED", ItemState.AS_PACK, null, 145));
        r.add(hi("COMPOUND_DELI_MEAT", "ham|salami|prosciutto|deli", "PACKAGED", ItemState.AS_PACK, null, 146));
        r.add(hi("COMPOUND_BACON", "bacon", "PROTEINS", ItemState.RAW, null, 147));
        r.add(hi("COMPOUND_INSTANT_NOODLES", "instant\\s*noodle|ramen", "PACKAGED", ItemState.AS_PACK, null, 150));
        r.add(hi("COMPOUND_BREAD", "bread|toast|bagel|roll\\b|bun\\b", "PACKAGED", ItemState.AS_PACK, null, 155));
        r.add(hi("COMPOUND_TORTILLA", "tortilla|wrap\\b|pita", "PACKAGED", ItemState.AS_PACK, null, 156));

        // ===== 200-299：穀物 / 蛋白質 =====
        r.add(med("GRAINS_RICE", "rice", "GRAINS", ItemState.DRY, 205));
        r.add(med("GRAINS_PASTA", "pasta|spaghetti|penne|macaroni|fusilli|fettuccine|linguine|noodle", "GRAINS", ItemState.DRY, 210));
        r.add(med("GRAINS_OATS", "\\boats?\\b|porridge|muesli", "GRAINS", ItemState.DRY, 220));
        r.add(med("GRAINS_QUINOA", "quinoa", "GRAINS", ItemState.DRY, 221));
        r.add(med("GRAINS_COUSCOUS", "couscous", "GRAINS", ItemState.DRY, 222));
        r.add(med("GRAINS_BARLEY", "barley|bulgur|buckwheat", "GRAINS", ItemState.DRY, 223));
        r.add(med("PROTEINS_CHICKEN", "chicken|turkey", "PROTEINS", ItemState.RAW, 230));
        r.add(med("PROTEINS_BEEF", "beef|steak|veal", "PROTEINS", ItemState.RAW, 235));
        r.add(med("PROTEINS_PORK", "pork", "PROTEINS", ItemState.RAW, 240));
        r.add(med("PROTEINS_LAMB", "lamb", "PROTEINS", ItemState.RAW, 241));
        r.add(med("PROTEINS_FISH", "salmon|tuna|cod|fish|snapper|barramundi|basa", "PROTEINS", ItemState.RAW, 245));
        r.add(med("PROTEINS_PRAWNS", "prawn|shrimp", "PROTEINS", ItemState.RAW, 250));
        r.add(med("PROTEINS_EGGS", "\\beggs?\\b", "PROTEINS", ItemState.RAW, 255));
        r.add(med("PROTEINS_TOFU", "tofu|tempeh", "PROTEINS", ItemState.AS_PACK, 256));

        // ===== 300-399：乳製品 =====
        r.add(med("DAIRY_MILK", "milk", "DAIRY", ItemState.AS_PACK, 300));
        r.add(med("DAIRY_CHEESE", "cheese|cheddar|mozzarella|parmesan|feta|ricotta", "DAIRY", ItemState.AS_PACK, 305));
        r.add(med("DAIRY_YOGURT", "yogurt|yoghurt|kefir", "DAIRY", ItemState.AS_PACK, 310));
        r.add(med("DAIRY_BUTTER", "butter|ghee", "DAIRY", ItemState.AS_PACK, 315));
        r.add(med("DAIRY_CREAM", "cream", "DAIRY", ItemState.AS_PACK, 320));

        // ===== 400-499：豆類 =====
        r.add(med("LEGUMES_LENTILS", "lentil", "LEGUMES", ItemState.DRY, 400));
        r.add(med("LEGUMES_CHICKPEAS", "chickpea", "LEGUMES", ItemState.DRY, 401));
        r.add(med("LEGUMES_DRY_BEANS", "(black|kidney|pinto|cannellini|navy)\\s*beans?", "LEGUMES", ItemState.DRY, 402));
        r.add(med("LEGUMES_SPLIT_PEAS", "split\\s*peas?", "LEGUMES", ItemState.DRY, 403));

        // ===== 500-599：蔬果 =====
        r.add(med("PRODUCE_POTATO", "potato|kumara|yam", "PRODUCE", ItemState.RAW, 500));
        r.add(med("PRODUCE_VEG", "onion|garlic|tomato|carrot|broccoli|spinach|kale|capsicum|pepper|zucchini|cucumber"
                + "|lettuce|mushroom|avocado|celery|asparagus|green\\s*beans?|corn|eggplant|cauliflower|cabbage|peas?\\b|ginger",
                "PRODUCE", ItemState.RAW, 510));
        r.add(med("PRODUCE_FRUIT", "apple|banana|orange|lemon|lime|berr|mango|pineapple|grape|melon|peach|pear|kiwi",
                "PRODUCE", ItemState.RAW, 550));

        // ===== 600-699：堅果種子 =====
        r.add(med("NUTS_SEEDS", "almond|walnut|cashew|peanut|macadamia|pecan|pistachio|chia|flax|sunflower|pumpkin\\s*seed|sesame",
                "NUTS_SEEDS", ItemState.AS_PACK, 600));

        // ===== 700-799：調味 / 油 =====
        r.add(med("CONDIMENTS_SAUCE", "sauce|vinegar|mustard|mayo|ketchup|honey|syrup|dressing|salsa", "CONDIMENTS", ItemState.AS_PACK, 700));
        r.add(med("CONDIMENTS_OIL", "\\boil\\b", "CONDIMENTS", ItemState.AS_PACK, 710));
        r.add(med("CONDIMENTS_SPICE", "salt|spice|herb|cumin|paprika|cinnamon|oregano|basil|parsley", "CONDIMENTS", ItemState.AS_PACK, 720));

        // ===== 800-899：包裝品 / 飲料 =====
        r.add(med("PACKAGED_CANNED", "canned|tinned|frozen|stock|broth", "PACKAGED", ItemState.AS_PACK, 800));
        r.add(med("BEVERAGES", "juice|coffee|tea\\b|soda|smoothie|protein\\s*powder|whey", "BEVERAGES", ItemState.AS_PACK, 850));

        // ===== catch-all =====
        r.add(new Rule("CATCHALL_UNMAPPED", Pattern.compile(".*"), "PACKAGED", ItemState.AS_PACK, null, 9999, Confidence.LOW));

        r.sort(Comparator.comparingInt(Rule::priority));
        RULES = List.copyOf(r);
    }

    public static StateResolution resolve(String itemKey) {
        if (itemKey == null || itemKey.isBlank()) {
            return new StateResolution(null, null, Confidence.NONE, "ERROR_INVALID_KEY", null);
        }

        String k = itemKey.toLowerCase(Locale.ROOT).replace('_', ' ').trim();

        for (CookingKeyword ck : COOKING_KEYWORDS) {
            if (ck.pattern().matcher(k).find()) {
                String id = "COOKING_KEYWORD_" + ck.keyword().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "_");
                return new StateResolution(ItemState.COOKED, ck.method(), Confidence.HIGH, id, "PREPARED");
            }
        }

        for (Rule r : RULES) {
            if (r.pattern().matcher(k).find()) {
                return new StateResolution(r.state(), r.method(), r.confidence(), r.id(), r.category());
            }
        }

        // 理論上到不了（有 catch-all）
        return new StateResolution(ItemState.AS_PACK, null, Confidence.LOW, "FALLBACK_UNREACHABLE", "PACKAGED");
    }

    public static List<Rule> rules() {
        return RULES;
    }

    private static CookingKeyword kw(String keyword, CookingMethod method) {
        // 前後不能接字母，避免 "uncooked" 命中 cooked
        Pattern p = Pattern.compile("(?<![a-z])" + Pattern.quote(keyword) + "(?![a-z])");
        return new CookingKeyword(keyword, method, p);
    }

    private static Rule hi(String id, String regex, String cat, ItemState s, CookingMethod m, int prio) {
        return new Rule(id, Pattern.compile(regex), cat, s, m, prio, Confidence.HIGH);
    }

    private static Rule med(String id, String regex, String cat, ItemState s, int prio) {
        return new Rule(id, Pattern.compile(regex), cat, s, null, prio, Confidence.MEDIUM);
    }
}
