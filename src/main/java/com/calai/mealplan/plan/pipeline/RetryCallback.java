package com.calai.mealplan.plan.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 驗證失敗後重新產生 meals（重打 generator）。不帶失敗原因。
 */
@FunctionalInterface
public interface RetryCallback {

    JsonNode regenerate();
}
