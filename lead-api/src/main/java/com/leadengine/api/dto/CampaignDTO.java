package com.leadengine.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 跟进活动视图
 */
@Data
public class CampaignDTO {

    private Long id;

    private Long tenantId;

    private String name;

    private List<String> targetStatuses;

    private Integer minScore;

    private Integer maxScore;

    private List<String> targetSources;

    private String messageTemplate;

    private List<String> channels;

    private String status;

    private LocalDateTime scheduledAt;

    private LocalDateTime executedAt;

    private Integer totalTargeted;

    private Integer totalSent;

    private Integer totalFailed;

    private LocalDateTime createdAt;
}
