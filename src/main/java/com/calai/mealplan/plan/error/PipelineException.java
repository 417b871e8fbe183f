package com.calai.mealplan.plan.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * pipeline 所有「要讓呼叫端知道」的失敗都從這裡出去：
 * code 給 advice 對應 HTTP status，context 帶重現問題需要的值（key / expected / actual）
 */
public abstract class PipelineException extends RuntimeException {

    private final String code;
    private final String traceId;
    private final String stage;
    private final Map<String, Object> context;

    protected PipelineException(String code, String message, String traceId, String stage,
                                Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.traceId = traceId;
        this.stage = stage;
        this.context = (context == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String code() { return code; }
    public String traceId() { return traceId; }
    public String stage() { return stage; }
    public Map<String, Object> context() { return context; }

    /** 會不會因為重打上游就好（給 caller 決定要不要 retry） */
    public boolean recoverable() {
        return false;
    }
}
