package com.leadengine.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 创建跟进活动请求
 */
@Data
public class CampaignCreateRequestDTO {

    private Long tenantId;

    private String name;

    /**
     * 目标线索状态编码，为空时默认 open
     */
    private List<String> targetStatuses;

    private Integer minScore;

    private Integer maxScore;

    private List<String> targetSources;

    /**
     * 消息模板，支持 {name} 占位符
     */
    private String messageTemplate;

    private List<String> channels;

    /**
     * 计划执行时间，为空时仅保存草稿
     */
    private LocalDateTime scheduledAt;
}
