package com.leadengine.domain.conversation.model.valobj;

import com.leadengine.types.enums.ChannelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 渠道适配层产出的标准化入站消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundEnvelope {

    private ChannelEnum channel;

    private String externalUserId;

    private String displayName;

    private String text;

    /**
     * 按钮/列表回调 ID
     */
    private String structuredChoiceId;

    private String mediaRef;

    /**
     * 用户通过渠道分享的联系人手机号
     */
    private String contactPhone;
}
