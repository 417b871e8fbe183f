package com.calai.mealplan.plan.alert;

public enum AlertLevel {
    CRITICAL,
    WARNING,
    INFO
}
