package com.calai.mealplan.plan.web;

import com.calai.mealplan.common.web.TraceIdFilter;
import com.calai.mealplan.plan.controller.MealPlanController;
import com.calai.mealplan.plan.dto.MealPlanErrorResponse;
import com.calai.mealplan.plan.error.LlmValidationException;
import com.calai.mealplan.plan.error.PipelineException;
import com.calai.mealplan.plan.error.PlanValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(assignableTypes = MealPlanController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MealPlanExceptionAdvice {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<MealPlanErrorResponse> handlePipeline(PipelineException e, HttpServletRequest req) {
        HttpStatus status = switch (e.code()) {
            case "STRUCTURAL_ERROR", "JSON_UNREPAIRABLE" -> HttpStatus.BAD_REQUEST;

            case "LLM_VALIDATION_FAILED",
                 "RESPONSE_BLOCKED",
                 "PLAN_VALIDATION_FAILED" -> HttpStatus.UNPROCESSABLE_ENTITY;

            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        Map<String, Object> details = new LinkedHashMap<>(e.context());
        if (e instanceof LlmValidationException lve) {
            details.put("validationErrors", lve.validationErrors());
        } else if (e instanceof PlanValidationException pve) {
            details.put("critical", pve.report().critical());
        }

        String traceId = e.traceId() != null ? e.traceId() : tid(req);
        return ResponseEntity.status(status).body(new MealPlanErrorResponse(
                e.code(), safeMsgOrCode(e, e.code()), traceId, e.stage(), details.isEmpty() ? null : details));
    }

    /**
     * Bean Validation（@Valid）失敗：例如 targets 缺值
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MealPlanErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        FieldError fe = e.getBindingResult().getFieldErrors().isEmpty()
                ? null
                : e.getBindingResult().getFieldErrors().get(0);
        String msg = (fe == null) ? "VALIDATION_FAILED" : fe.getField() + " " + fe.getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new MealPlanErrorResponse("VALIDATION_FAILED", msg, tid(req)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MealPlanErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new MealPlanErrorResponse("BAD_REQUEST", "Request body is not valid JSON", tid(req)));
    }

    /**
     * 組態 override 不合法（PipelineConfig 建構時檢查）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<MealPlanErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new MealPlanErrorResponse(code, safeMsgOrCode(e, code), tid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MealPlanErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("meal_plan_unhandled traceId={}", tid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new MealPlanErrorResponse("INTERNAL_ERROR", "INTERNAL_ERROR", tid(req)));
    }

    // ===== helpers =====

    private static String tid(HttpServletRequest req) {
        return TraceIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
