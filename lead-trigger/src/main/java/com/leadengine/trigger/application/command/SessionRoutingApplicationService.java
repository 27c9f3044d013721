package com.leadengine.trigger.application.command;

import com.leadengine.domain.session.adapter.repository.IRoutingSessionRepository;
import com.leadengine.domain.session.model.valobj.BootstrapToken;
import com.leadengine.domain.session.model.valobj.RouteDecision;
import com.leadengine.domain.session.model.valobj.RoutingSession;
import com.leadengine.domain.session.service.SessionRoutingDomainService;
import com.leadengine.types.enums.ChannelEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 共享渠道入口的租户路由：启动令牌新建/覆盖会话，后续消息刷新会话过期时间。
 */
@Slf4j
@Service
public class SessionRoutingApplicationService {

    private final IRoutingSessionRepository routingSessionRepository;
    private final SessionRoutingDomainService sessionRoutingDomainService;
    private final Duration sessionTtl;

    public SessionRoutingApplicationService(IRoutingSessionRepository routingSessionRepository,
                                            SessionRoutingDomainService sessionRoutingDomainService,
                                            @Value("${session.ttl-hours:24}") long ttlHours) {
        this.routingSessionRepository = routingSessionRepository;
        this.sessionRoutingDomainService = sessionRoutingDomainService;
        this.sessionTtl = Duration.ofHours(ttlHours > 0 ? ttlHours : 24);
    }

    /**
     * 路由入站消息
     *
     * @param dedicatedTenantId 专属入口的租户 ID，非空时直接路由
     */
    public RoutedText route(ChannelEnum channel, String externalUserId, String text, Long dedicatedTenantId) {
        if (dedicatedTenantId != null) {
            return new RoutedText(RouteDecision.dedicated(dedicatedTenantId), text);
        }

        BootstrapToken token = sessionRoutingDomainService.parseToken(text);
        if (token != null) {
            LocalDateTime now = LocalDateTime.now();
            RoutingSession session = RoutingSession.builder()
                    .channel(channel)
                    .externalUserId(externalUserId)
                    .tenantId(token.tenantId())
                    .vertical(token.vertical())
                    .createdAt(now)
                    .lastSeenAt(now)
                    .build();
            routingSessionRepository.save(session, sessionTtl);
            log.info("Routing session bootstrapped. channel={}, externalUserId={}, tenantId={}, vertical={}",
                    channel.getCode(), externalUserId, token.tenantId(), token.vertical().getCode());
            return new RoutedText(new RouteDecision(true, token.tenantId(), token.vertical(), true),
                    sessionRoutingDomainService.stripToken(text, token));
        }

        RoutingSession session = routingSessionRepository.find(channel, externalUserId);
        if (session == null || session.getTenantId() == null) {
            log.info("Inbound message not routed, no token and no session. channel={}, externalUserId={}",
                    channel.getCode(), externalUserId);
            return new RoutedText(RouteDecision.notRouted(), text);
        }
        routingSessionRepository.touch(session, sessionTtl);
        return new RoutedText(new RouteDecision(true, session.getTenantId(), session.getVertical(), false), text);
    }

    /**
     * 路由结果与去掉启动令牌后的文本
     */
    public record RoutedText(RouteDecision decision, String text) {
    }
}
