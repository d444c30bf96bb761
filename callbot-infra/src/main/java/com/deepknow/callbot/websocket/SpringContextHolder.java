package com.deepknow.callbot.websocket;

import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.stereotype.Component;

/**
 * 容器外实例化的端点（javax.websocket 按连接 new 一个）通过它取 Bean。
 */
@Component
public class SpringContextHolder implements ApplicationContextAware {
    private static ApplicationContext ctx;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) {
        SpringContextHolder.ctx = applicationContext;
    }

    public static <T> T getBean(Class<T> clazz) {
        return ctx == null ? null : ctx.getBean(clazz);
    }
}
