package com.calai.mealplan.plan.service;

import com.calai.mealplan.plan.correction.MealsJsonRepairUtil;
import com.calai.mealplan.plan.dto.ComputeMealPlanRequest;
import com.calai.mealplan.plan.dto.MealPlanResponse;
import com.calai.mealplan.plan.error.JsonUnrepairableException;
import com.calai.mealplan.plan.pipeline.PipelineRequest;
import com.calai.mealplan.plan.pipeline.PipelineResult;
import com.calai.mealplan.plan.pipeline.PlanPipeline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MealPlanService {

    private final PlanPipeline pipeline;
    private final ObjectMapper om;

    /**
     * HTTP 沒有 regeneration 來源，所以不帶 retry callback（驗證失敗就直接失敗）
     */
    public MealPlanResponse compute(ComputeMealPlanRequest req, String traceId) {
        JsonNode raw = resolveRawMeals(req, traceId);

        PipelineRequest pr = PipelineRequest.of(raw, req.targets().toTargets())
                .withConfig(req.config())
                .withTraceId(traceId);

        PipelineResult result = pipeline.execute(pr);
        return MealPlanResponse.from(result);
    }

    private JsonNode resolveRawMeals(ComputeMealPlanRequest req, String traceId) {
        JsonNode raw = req.rawMeals();
        if (raw != null && !raw.isNull() && !raw.isMissingNode()) return raw;

        String text = req.rawText();
        if (text == null || text.isBlank()) return raw; // entry guard 會擋

        JsonNode repaired = MealsJsonRepairUtil.repairOrNull(om, text);
        if (repaired == null) {
            throw new JsonUnrepairableException(text.length(), traceId);
        }
        log.info("meals_text_repaired traceId={} textLen={} meals={}", traceId, text.length(), repaired.size());
        return repaired;
    }
}
