package com.leadengine.api.dto;

import lombok.Data;

/**
 * 线索识别请求：按 profileUrl、渠道用户 ID、手机号的优先级查找或创建
 */
@Data
public class LeadResolveRequestDTO {

    private Long tenantId;

    private String channel;

    private String channelUserId;

    private String profileUrl;

    private String phone;

    private String name;

    private String email;

    private String jobTitle;

    private String company;

    private String source;

    private String language;
}
