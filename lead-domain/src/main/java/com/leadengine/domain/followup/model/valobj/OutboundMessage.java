package com.leadengine.domain.followup.model.valobj;

import com.leadengine.types.enums.ChannelEnum;

/**
 * 发往渠道发送方的一条出站文本消息。
 *
 * @param leadId    线索 ID
 * @param channel   渠道
 * @param recipient 渠道内的接收方 ID
 * @param text      文本
 */
public record OutboundMessage(Long leadId, ChannelEnum channel, String recipient, String text) {
}
