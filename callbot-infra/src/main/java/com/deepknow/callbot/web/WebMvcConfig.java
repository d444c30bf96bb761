package com.deepknow.callbot.web;

import com.deepknow.callbot.config.AuthProperties;
import com.deepknow.callbot.config.RateLimitProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final AuthProperties authProperties;

    public WebMvcConfig(AuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiTokenInterceptor(authProperties.getServiceApiToken(), authProperties.isAllowUnauthenticated()))
                .addPathPatterns("/api/**");
    }

    // 排在容器的 WebSocket 升级过滤器之前，握手请求同样计数
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(RateLimitProperties rateLimitProperties) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(new RateLimitFilter(rateLimitProperties));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.setEnabled(rateLimitProperties.isEnabled());
        return registration;
    }
}
