package com.calai.mealplan.plan.dto;

import com.calai.mealplan.plan.config.PipelineConfigOverrides;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * rawMeals（JSON array）跟 rawText（generator 原始文字）擇一；兩個都有時以 rawMeals 為準
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComputeMealPlanRequest(
        JsonNode rawMeals,
        String rawText,
        @NotNull(message = "Targets are required") @Valid MacroTargetsRequest targets,
        PipelineConfigOverrides config
) {}
