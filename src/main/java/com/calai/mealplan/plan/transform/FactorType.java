package com.calai.mealplan.plan.transform;

public enum FactorType {
    /** 穀物 / 豆類：煮熟會變重（factor > 1） */
    DRY_TO_COOKED,
    /** 肉 / 蔬菜：煮熟會失水（factor < 1） */
    RAW_TO_COOKED
}
