package com.calai.mealplan.plan.web;

import com.calai.mealplan.common.web.TraceIdFilter;
import com.calai.mealplan.plan.controller.MealPlanController;
import com.calai.mealplan.plan.error.LlmValidationException;
import com.calai.mealplan.plan.error.PlanValidationException;
import com.calai.mealplan.plan.error.ResponseBlockedException;
import com.calai.mealplan.plan.pipeline.PlanValidationReport;
import com.calai.mealplan.plan.pipeline.ValidationIssue;
import com.calai.mealplan.plan.service.MealPlanService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = MealPlanController.class)
@Import({MealPlanExceptionAdvice.class, TraceIdFilter.class})
class MealPlanExceptionAdviceTest {

    private static final String URL = "/api/v1/meal-plans/compute";
    private static final String BODY = """
            {"rawMeals": [{"type":"lunch","name":"lunch","items":[]}], "targets": {"kcal": 2000, "protein": 120}}
            """;

    @Autowired MockMvc mvc;

    @MockitoBean MealPlanService service;

    @Test
    void llm_validation_failure_should_422_with_errors() throws Exception {
        Mockito.when(service.compute(any(), eq("TID-llm")))
                .thenThrow(new LlmValidationException(
                        List.of("attempt 1: [0].type invalid meal type 'feast'"), 1, "TID-llm", "VALIDATE_LLM_OUTPUT"));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).header("X-Trace-Id", "TID-llm").content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(header().string("X-Trace-Id", "TID-llm"))
                .andExpect(jsonPath("$.errorCode").value("LLM_VALIDATION_FAILED"))
                .andExpect(jsonPath("$.stage").value("VALIDATE_LLM_OUTPUT"))
                .andExpect(jsonPath("$.details.attempts").value(1))
                .andExpect(jsonPath("$.details.validationErrors[0]").value("attempt 1: [0].type invalid meal type 'feast'"));
    }

    @Test
    void response_blocked_should_422() throws Exception {
        Mockito.when(service.compute(any(), any()))
                .thenThrow(new ResponseBlockedException(17, 20, 85.0, 80.0, "TID-blk", "RESPONSE_BLOCK_CHECK"));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("RESPONSE_BLOCKED"))
                .andExpect(jsonPath("$.traceId").value("TID-blk"))
                .andExpect(jsonPath("$.details.flaggedCount").value(17))
                .andExpect(jsonPath("$.details.flaggedRatePct").value(85.0));
    }

    @Test
    void plan_validation_failure_should_422_with_critical_issues() throws Exception {
        PlanValidationReport report = PlanValidationReport.of(List.of(
                ValidationIssue.critical("ITEM_HIGH_CALORIES", "Item 'lard' has 1500 kcal (> 1200)", Map.of("key", "lard"))));
        Mockito.when(service.compute(any(), any()))
                .thenThrow(new PlanValidationException(report, "TID-plan", "VALIDATE_PLAN"));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("PLAN_VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.critical[0].code").value("ITEM_HIGH_CALORIES"));
    }

    @Test
    void unexpected_error_should_500_without_leaking_message() throws Exception {
        Mockito.when(service.compute(any(), any())).thenThrow(new IllegalStateException("db password is hunter2"));

        mvc.perform(post(URL).contentType(MediaType.APPLICATION_JSON).header("X-Trace-Id", "TID-500").content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.traceId").value("TID-500"));
    }
}
