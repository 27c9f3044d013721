package com.leadengine.infrastructure.repository.session;

import com.google.common.cache.Cache;
import com.leadengine.domain.session.adapter.repository.IRoutingSessionRepository;
import com.leadengine.domain.session.model.valobj.RoutingSession;
import com.leadengine.types.enums.ChannelEnum;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 单实例部署使用的本地路由会话存储。
 */
@Repository
@ConditionalOnProperty(name = "session.store", havingValue = "local")
public class LocalRoutingSessionRepository implements IRoutingSessionRepository {

    private final Cache<String, Entry> routingSessionCache;

    public LocalRoutingSessionRepository(@Qualifier("routingSessionCache") Cache<String, Entry> routingSessionCache) {
        this.routingSessionCache = routingSessionCache;
    }

    @Override
    public RoutingSession find(ChannelEnum channel, String externalUserId) {
        String key = RedisRoutingSessionRepository.buildKey(channel, externalUserId);
        Entry entry = routingSessionCache.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt().isBefore(LocalDateTime.now())) {
            routingSessionCache.invalidate(key);
            return null;
        }
        return copyOf(entry.session());
    }

    @Override
    public void save(RoutingSession session, Duration ttl) {
        put(session, ttl);
    }

    @Override
    public void touch(RoutingSession session, Duration ttl) {
        session.setLastSeenAt(LocalDateTime.now());
        put(session, ttl);
    }

    private void put(RoutingSession session, Duration ttl) {
        String key = RedisRoutingSessionRepository.buildKey(session.getChannel(), session.getExternalUserId());
        routingSessionCache.put(key, new Entry(copyOf(session), LocalDateTime.now().plus(ttl)));
    }

    private RoutingSession copyOf(RoutingSession session) {
        return RoutingSession.builder()
                .channel(session.getChannel())
                .externalUserId(session.getExternalUserId())
                .tenantId(session.getTenantId())
                .vertical(session.getVertical())
                .createdAt(session.getCreatedAt())
                .lastSeenAt(session.getLastSeenAt())
                .build();
    }

    /**
     * 缓存条目，携带各自的过期时间
     */
    public record Entry(RoutingSession session, LocalDateTime expiresAt) {
    }
}
