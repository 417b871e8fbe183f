package com.calai.mealplan.plan.model;

/**
 * 一個食材項目（上游 generator 產生）。
 * quantityValue 可能是 null（缺值），交給 invariant / macro 計算處理。
 * stateHint / methodHint 為 null 代表 unset。
 */
public record Item(
        String key,
        Double quantityValue,
        String quantityUnit,
        ItemState stateHint,
        CookingMethod methodHint,
        StateResolution resolution
) {

    public Item(String key, Double quantityValue, String quantityUnit, ItemState stateHint, CookingMethod methodHint) {
        this(key, quantityValue, quantityUnit, stateHint, methodHint, null);
    }

    public static Item of(String key, double quantityValue, String quantityUnit) {
        return new Item(key, quantityValue, quantityUnit, null, null, null);
    }

    public Item withQuantityValue(double value) {
        return new Item(key, value, quantityUnit, stateHint, methodHint, resolution);
    }

    public Item withResolution(StateResolution r, ItemState state, CookingMethod method) {
        return new Item(key, quantityValue, quantityUnit, state, method, r);
    }

    public Item withStateHint(ItemState state) {
        return new Item(key, quantityValue, quantityUnit, state, methodHint, resolution);
    }

    public Item withMethodHint(CookingMethod method) {
        return new Item(key, quantityValue, quantityUnit, stateHint, method, resolution);
    }

    public String keyOrEmpty() {
        return key == null ? "" : key;
    }
}
