package com.deepknow.callbot.web;

import com.deepknow.callbot.config.RateLimitProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 全局按客户端地址限流，挂在所有路径上（含音频套接字的握手请求）。
 * 窗口从该客户端的第一个请求开始计时，一分钟后随缓存条目过期而重置。
 */
public class RateLimitFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final int maxPerWindow;
    private final Set<String> allowList;
    private final Ticker ticker;
    private final Cache<String, Window> windows;

    public RateLimitFilter(RateLimitProperties props) {
        this(props, Ticker.systemTicker());
    }

    RateLimitFilter(RateLimitProperties props, Ticker ticker) {
        this.maxPerWindow = props.getMaxPerMinute();
        this.allowList = new HashSet<>(props.getAllowList());
        this.ticker = ticker;
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(WINDOW)
                .maximumSize(props.getMaxClients())
                .ticker(ticker)
                .build();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return maxPerWindow <= 0 || allowList.contains(request.getRemoteAddr());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String client = request.getRemoteAddr();
        Window window = windows.get(client, k -> new Window(ticker.read()));
        int count = window.requests.incrementAndGet();
        response.setHeader(LIMIT_HEADER, String.valueOf(maxPerWindow));
        response.setHeader(REMAINING_HEADER, String.valueOf(Math.max(0, maxPerWindow - count)));
        if (count <= maxPerWindow) {
            filterChain.doFilter(request, response);
            return;
        }
        long retryAfter = window.secondsUntilReset(ticker.read());
        log.warn("Rate limit exceeded: remote={} path={} count={} retryAfterSec={}",
                client, request.getRequestURI(), count, retryAfter);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"errorCode\":\"RateLimited\",\"message\":\"Rate limit exceeded, retry in "
                + retryAfter + " seconds\",\"timestamp\":\"" + Instant.now() + "\"}");
    }

    private static final class Window {
        final long startedNanos;
        final AtomicInteger requests = new AtomicInteger();

        Window(long startedNanos) {
            this.startedNanos = startedNanos;
        }

        long secondsUntilReset(long nowNanos) {
            long remaining = startedNanos + WINDOW.toNanos() - nowNanos;
            return Math.max(1, TimeUnit.NANOSECONDS.toSeconds(remaining + TimeUnit.SECONDS.toNanos(1) - 1));
        }
    }
}
