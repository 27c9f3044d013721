package com.leadengine.domain.followup.adapter.gateway;

import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.types.exception.ChannelDeliveryException;

/**
 * 渠道发送方，负责把出站消息交给具体渠道适配层。
 */
public interface IChannelSender {

    /**
     * 发送消息
     *
     * @throws ChannelDeliveryException 投递失败，transientFailure 标识是否可重试
     */
    void send(OutboundMessage message) throws ChannelDeliveryException;
}
