package com.deepknow.callbot.web;

import com.deepknow.callbot.config.RateLimitProperties;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private final AtomicLong nanos = new AtomicLong(TimeUnit.HOURS.toNanos(1));

    private RateLimitFilter filter(int maxPerMinute) {
        RateLimitProperties props = new RateLimitProperties();
        props.setMaxPerMinute(maxPerMinute);
        return new RateLimitFilter(props, nanos::get);
    }

    @Test
    void allowsUpToLimitThenRejectsWithRetryAfter() throws Exception {
        RateLimitFilter filter = filter(3);

        for (int i = 0; i < 3; i++) {
            MockHttpServletResponse ok = call(filter, "10.0.0.1");
            assertThat(ok.getStatus()).isEqualTo(200);
            assertThat(ok.getHeader(RateLimitFilter.REMAINING_HEADER)).isEqualTo(String.valueOf(2 - i));
        }
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(15));
        MockHttpServletResponse limited = call(filter, "10.0.0.1");

        assertThat(limited.getStatus()).isEqualTo(429);
        assertThat(limited.getHeader("Retry-After")).isEqualTo("45");
        assertThat(limited.getHeader(RateLimitFilter.LIMIT_HEADER)).isEqualTo("3");
        assertThat(limited.getContentAsString()).contains("\"errorCode\":\"RateLimited\"");
    }

    @Test
    void rejectedRequestNeverReachesTheChain() throws Exception {
        RateLimitFilter filter = filter(1);
        call(filter, "10.0.0.1");

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request("10.0.0.1"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void windowResetsAfterOneMinute() throws Exception {
        RateLimitFilter filter = filter(1);
        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(429);

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(61));

        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
    }

    @Test
    void clientsAreCountedSeparately() throws Exception {
        RateLimitFilter filter = filter(1);

        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.2").getStatus()).isEqualTo(200);
        assertThat(call(filter, "10.0.0.1").getStatus()).isEqualTo(429);
    }

    @Test
    void loopbackIsNeverLimited() throws Exception {
        RateLimitFilter filter = filter(1);

        for (int i = 0; i < 5; i++) {
            assertThat(call(filter, "127.0.0.1").getStatus()).isEqualTo(200);
            assertThat(call(filter, "0:0:0:0:0:0:0:1").getStatus()).isEqualTo(200);
        }
    }

    private static MockHttpServletResponse call(RateLimitFilter filter, String remoteAddr) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request(remoteAddr), response, new MockFilterChain());
        return response;
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/respond");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
