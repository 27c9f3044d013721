package com.leadengine.domain.session.model.valobj;

import com.leadengine.types.enums.VerticalEnum;

/**
 * 入站消息路由结果。
 *
 * @param routed       是否路由到租户
 * @param tenantId     租户 ID
 * @param vertical     业务线
 * @param bootstrapped 是否由本条消息中的启动令牌新建会话
 */
public record RouteDecision(boolean routed, Long tenantId, VerticalEnum vertical, boolean bootstrapped) {

    public static RouteDecision notRouted() {
        return new RouteDecision(false, null, null, false);
    }

    public static RouteDecision dedicated(Long tenantId) {
        return new RouteDecision(true, tenantId, null, false);
    }
}
