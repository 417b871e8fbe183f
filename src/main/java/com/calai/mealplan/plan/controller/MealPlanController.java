package com.calai.mealplan.plan.controller;

import com.calai.mealplan.common.web.TraceIdFilter;
import com.calai.mealplan.plan.dto.ComputeMealPlanRequest;
import com.calai.mealplan.plan.dto.MealPlanResponse;
import com.calai.mealplan.plan.service.MealPlanService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/meal-plans")
public class MealPlanController {

    private final MealPlanService service;

    @PostMapping("/compute")
    public MealPlanResponse compute(@Valid @RequestBody ComputeMealPlanRequest body, HttpServletRequest req) {
        String traceId = TraceIdFilter.getOrCreate(req);
        return service.compute(body, traceId);
    }
}
