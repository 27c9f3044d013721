package com.leadengine.api.dto;

import lombok.Data;

/**
 * 渠道适配层转发的入站消息
 */
@Data
public class InboundMessageRequestDTO {

    /**
     * 渠道编码：telegram / whatsapp
     */
    private String channel;

    /**
     * 渠道内用户 ID
     */
    private String externalUserId;

    private String displayName;

    /**
     * 自由文本，可空
     */
    private String text;

    /**
     * 按钮/列表选项 ID，优先于文本
     */
    private String choiceId;

    private String mediaRef;

    /**
     * 渠道原生分享的联系人手机号
     */
    private String contactPhone;
}
