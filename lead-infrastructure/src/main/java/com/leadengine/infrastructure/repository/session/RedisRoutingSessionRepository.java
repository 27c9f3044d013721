package com.leadengine.infrastructure.repository.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.leadengine.domain.session.adapter.repository.IRoutingSessionRepository;
import com.leadengine.domain.session.model.valobj.RoutingSession;
import com.leadengine.infrastructure.util.JsonCodec;
import com.leadengine.types.common.Constants;
import com.leadengine.types.enums.ChannelEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 基于 Redis 的路由会话存储，键为 lead:session:{channel}:{externalUserId}，值为 JSON。
 * Redis 不可用时读取返回空，由下一次启动令牌重建会话。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "session.store", havingValue = "redis", matchIfMissing = true)
public class RedisRoutingSessionRepository implements IRoutingSessionRepository {

    private final StringRedisTemplate redisTemplate;
    private final JsonCodec jsonCodec;

    public RedisRoutingSessionRepository(StringRedisTemplate redisTemplate, JsonCodec jsonCodec) {
        this.redisTemplate = redisTemplate;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public RoutingSession find(ChannelEnum channel, String externalUserId) {
        String key = buildKey(channel, externalUserId);
        try {
            String cached = redisTemplate.opsForValue().get(key);
            if (cached == null) {
                return null;
            }
            return jsonCodec.readValue(cached, new TypeReference<RoutingSession>() {});
        } catch (RuntimeException ex) {
            log.warn("Routing session read failed. key={}, error={}", key, ex.getMessage());
            return null;
        }
    }

    @Override
    public void save(RoutingSession session, Duration ttl) {
        write(session, ttl);
    }

    @Override
    public void touch(RoutingSession session, Duration ttl) {
        session.setLastSeenAt(LocalDateTime.now());
        write(session, ttl);
    }

    private void write(RoutingSession session, Duration ttl) {
        String key = buildKey(session.getChannel(), session.getExternalUserId());
        try {
            redisTemplate.opsForValue().set(key, jsonCodec.writeValue(session), ttl);
        } catch (RuntimeException ex) {
            log.warn("Routing session write failed. key={}, error={}", key, ex.getMessage());
        }
    }

    static String buildKey(ChannelEnum channel, String externalUserId) {
        return Constants.SESSION_KEY_PREFIX + channel.getCode() + ":" + externalUserId;
    }
}
