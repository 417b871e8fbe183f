package com.calai.mealplan.plan.reconcile;

import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.MacroResult;

import java.util.List;

/**
 * item 的 macros；mealItems 是同一餐的全部 item（吸油分配要看整餐）
 */
@FunctionalInterface
public interface ItemMacrosFn {

    MacroResult apply(Item item, List<Item> mealItems);
}
