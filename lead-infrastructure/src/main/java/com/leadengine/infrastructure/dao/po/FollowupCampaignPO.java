package com.leadengine.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 跟进活动 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowupCampaignPO {

    private Long id;

    private Long tenantId;

    private String name;

    /**
     * 目标状态编码 (JSONB 数组)
     */
    private String targetStatuses;

    private Integer minScore;

    private Integer maxScore;

    /**
     * 目标来源编码 (JSONB 数组)
     */
    private String targetSources;

    private String messageTemplate;

    /**
     * 渠道编码 (JSONB 数组)
     */
    private String channels;

    private String status;

    private LocalDateTime scheduledAt;

    private LocalDateTime executedAt;

    private Integer totalTargeted;

    private Integer totalSent;

    private Integer totalFailed;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
