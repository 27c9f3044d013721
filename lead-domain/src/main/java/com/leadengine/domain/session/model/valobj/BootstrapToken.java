package com.leadengine.domain.session.model.valobj;

import com.leadengine.types.enums.VerticalEnum;

/**
 * 深链启动令牌 start_{vertical}_{tenantId} 的解析结果。
 */
public record BootstrapToken(VerticalEnum vertical, Long tenantId, String raw) {
}
