package com.leadengine.api.dto;

import lombok.Data;

/**
 * 外部渠道互动登记请求（如运营手动发出的 LinkedIn 消息）
 */
@Data
public class InteractionRecordRequestDTO {

    private String channel;

    /**
     * inbound / outbound
     */
    private String direction;

    private String text;
}
