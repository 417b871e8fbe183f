package com.calai.mealplan.common.web;

import com.calai.mealplan.common.trace.TraceIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 每個 request 一個 traceId：controller、advice、pipeline log 跟 alert 都用同一個。
 * 上游（gateway / generator worker）有帶 X-Trace-Id 就沿用，格式不對就換一個新的。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Trace-Id";
    public static final String ATTR = TraceIdFilter.class.getName() + ".traceId";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String incoming = req.getHeader(HEADER);
        String traceId;
        if (TraceIds.isUsable(incoming)) {
            traceId = incoming;
        } else {
            traceId = TraceIds.newId();
            if (incoming != null && !incoming.isBlank()) {
                log.debug("trace_id_replaced reason=INVALID_HEADER length={} traceId={}", incoming.length(), traceId);
            }
        }

        req.setAttribute(ATTR, traceId);
        res.setHeader(HEADER, traceId);

        String previous = MDC.get(TraceIds.MDC_KEY);
        MDC.put(TraceIds.MDC_KEY, traceId);
        try {
            chain.doFilter(req, res);
        } finally {
            if (previous == null) MDC.remove(TraceIds.MDC_KEY);
            else MDC.put(TraceIds.MDC_KEY, previous);
        }
    }

    /**
     * filter 沒跑到（例如 standalone MockMvc）時補一個，並記回 request，
     * 讓同一個 request 後面拿到的都是同一個值
     */
    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        if (v != null) return String.valueOf(v);
        String traceId = TraceIds.resolve(null);
        req.setAttribute(ATTR, traceId);
        return traceId;
    }
}
