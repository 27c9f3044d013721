package com.leadengine.domain.session.model.valobj;

import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.VerticalEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 共享渠道入口的路由会话，仅作路由参考，过期后由下一次启动令牌重建。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingSession {

    private ChannelEnum channel;

    private String externalUserId;

    private Long tenantId;

    private VerticalEnum vertical;

    private LocalDateTime createdAt;

    private LocalDateTime lastSeenAt;
}
