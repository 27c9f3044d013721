package com.leadengine.domain.session.adapter.repository;

import com.leadengine.domain.session.model.valobj.RoutingSession;
import com.leadengine.types.enums.ChannelEnum;

import java.time.Duration;

/**
 * 路由会话存储，写入即设置过期时间。
 */
public interface IRoutingSessionRepository {

    RoutingSession find(ChannelEnum channel, String externalUserId);

    /**
     * 新建或覆盖会话
     */
    void save(RoutingSession session, Duration ttl);

    /**
     * 刷新会话，记录最近活跃时间并重置过期时间
     */
    void touch(RoutingSession session, Duration ttl);
}
