package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.Correction;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * correctedOutput 一定有值（就算 valid=false 也盡量修過），caller 可以直接拿去用或拿去重打
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<Correction> corrections,
        JsonNode correctedOutput
) {
    public ValidationResult {
        errors = (errors == null) ? List.of() : List.copyOf(errors);
        corrections = (corrections == null) ? List.of() : List.copyOf(corrections);
    }
}
