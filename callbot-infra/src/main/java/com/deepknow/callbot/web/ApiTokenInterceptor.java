package com.deepknow.callbot.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * /api/** 的 Bearer 令牌校验，常量时间比较。
 * 未配置令牌时拒绝所有请求，除非显式开启开发模式放行。
 */
public class ApiTokenInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(ApiTokenInterceptor.class);

    private final String serviceApiToken;
    private final boolean allowUnauthenticated;

    public ApiTokenInterceptor(String serviceApiToken, boolean allowUnauthenticated) {
        this.serviceApiToken = serviceApiToken;
        this.allowUnauthenticated = allowUnauthenticated;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (serviceApiToken == null || serviceApiToken.isEmpty()) {
            if (allowUnauthenticated) {
                return true;
            }
            log.warn("Service API token not configured, reject: path={} remote={}", request.getRequestURI(), request.getRemoteAddr());
            return reject(response);
        }
        String incoming = tokenFromAuthHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (incoming != null && MessageDigest.isEqual(
                serviceApiToken.getBytes(StandardCharsets.UTF_8), incoming.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("Unauthorized request: path={} remote={}", request.getRequestURI(), request.getRemoteAddr());
        return reject(response);
    }

    /**
     * 解析 "Bearer &lt;token&gt;"，scheme 不区分大小写。
     *
     * @return 令牌；头缺失或格式不符时返回 null
     */
    static String tokenFromAuthHeader(String header) {
        if (header == null) {
            return null;
        }
        String[] parts = header.trim().split("\\s+", 2);
        if (parts.length != 2 || !"bearer".equalsIgnoreCase(parts[0]) || parts[1].isBlank()) {
            return null;
        }
        return parts[1].trim();
    }

    private static boolean reject(HttpServletResponse response) throws Exception {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"errorCode\":\"Unauthorized\",\"message\":\"Unauthorized\",\"timestamp\":\""
                + Instant.now() + "\"}");
        return false;
    }
}
