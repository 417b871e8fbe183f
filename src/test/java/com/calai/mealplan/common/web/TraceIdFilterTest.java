package com.calai.mealplan.common.web;

import com.calai.mealplan.common.trace.TraceIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void incoming_header_is_reused_and_mdc_cleared() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");
        req.addHeader(TraceIdFilter.HEADER, "TID-1");
        MockHttpServletResponse res = new MockHttpServletResponse();

        AtomicReference<String> seenInChain = new AtomicReference<>();
        filter.doFilter(req, res, capturing(seenInChain));

        assertThat(seenInChain.get()).isEqualTo("TID-1");
        assertThat(res.getHeader(TraceIdFilter.HEADER)).isEqualTo("TID-1");
        assertThat(TraceIdFilter.getOrCreate(req)).isEqualTo("TID-1");
        assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
    }

    @Test
    void blank_header_gets_generated_id() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");
        req.addHeader(TraceIdFilter.HEADER, "  ");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, new MockFilterChain());

        String generated = res.getHeader(TraceIdFilter.HEADER);
        assertThat(generated).isNotBlank().isNotEqualTo("  ");
        assertThat(TraceIdFilter.getOrCreate(req)).isEqualTo(generated);
    }

    @Test
    void header_with_log_breaking_chars_is_replaced() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");
        req.addHeader(TraceIdFilter.HEADER, "abc\nlevel=ERROR fake=1");
        MockHttpServletResponse res = new MockHttpServletResponse();

        AtomicReference<String> seenInChain = new AtomicReference<>();
        filter.doFilter(req, res, capturing(seenInChain));

        assertThat(seenInChain.get()).doesNotContain("\n").isNotEqualTo("abc\nlevel=ERROR fake=1");
        assertThat(TraceIds.isUsable(seenInChain.get())).isTrue();
        assertThat(res.getHeader(TraceIdFilter.HEADER)).isEqualTo(seenInChain.get());
    }

    @Test
    void overlong_header_is_replaced() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");
        req.addHeader(TraceIdFilter.HEADER, "a".repeat(TraceIds.MAX_LENGTH + 1));
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, new MockFilterChain());

        assertThat(res.getHeader(TraceIdFilter.HEADER)).hasSizeLessThanOrEqualTo(TraceIds.MAX_LENGTH);
    }

    @Test
    void outer_mdc_value_is_restored_after_request() throws Exception {
        MDC.put(TraceIds.MDC_KEY, "outer-job");
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");
        req.addHeader(TraceIdFilter.HEADER, "TID-inner");

        AtomicReference<String> seenInChain = new AtomicReference<>();
        filter.doFilter(req, new MockHttpServletResponse(), capturing(seenInChain));

        assertThat(seenInChain.get()).isEqualTo("TID-inner");
        assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("outer-job");
    }

    @Test
    void get_or_create_without_filter_is_stable_per_request() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/meal-plans/compute");

        String first = TraceIdFilter.getOrCreate(req);

        assertThat(first).isNotBlank();
        assertThat(TraceIdFilter.getOrCreate(req)).isEqualTo(first);
    }

    private static MockFilterChain capturing(AtomicReference<String> seen) {
        return new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response) {
                seen.set(MDC.get(TraceIds.MDC_KEY));
            }
        };
    }
}
