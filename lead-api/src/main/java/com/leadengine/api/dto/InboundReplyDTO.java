package com.leadengine.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 入站消息处理结果
 */
@Data
public class InboundReplyDTO {

    /**
     * 是否路由到租户；未路由时不创建线索，reply 为空
     */
    private Boolean routed;

    private Long tenantId;

    private Long leadId;

    /**
     * 处理后的会话状态
     */
    private String conversationState;

    private String reply;

    /**
     * 本轮是否为打断（开放问题回答 + 重复当前问题）
     */
    private Boolean interrupted;

    private List<OutboundRequestDTO> outbound;
}
