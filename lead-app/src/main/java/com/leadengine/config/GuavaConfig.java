package com.leadengine.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.leadengine.infrastructure.repository.session.LocalRoutingSessionRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 本地路由会话缓存，仅在 session.store=local 时启用（单实例部署或本地开发）。
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "routingSessionCache")
    @ConditionalOnProperty(name = "session.store", havingValue = "local")
    public Cache<String, LocalRoutingSessionRepository.Entry> routingSessionCache(
            @Value("${session.ttl-hours:24}") long ttlHours,
            @Value("${session.local-max-size:100000}") long maxSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlHours, 1L), TimeUnit.HOURS)
                .maximumSize(Math.max(maxSize, 1L))
                .build();
    }

}
