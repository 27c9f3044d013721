package com.leadengine.domain.followup.model.entity;

import com.leadengine.types.enums.CampaignStatusEnum;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 跟进活动实体：按状态/分数/来源圈选线索并批量发送模板消息。
 */
@Data
public class FollowupCampaignEntity {

    private Long id;

    private Long tenantId;

    private String name;

    /**
     * 目标线索状态，为空时默认 open
     */
    private List<LeadStatusEnum> targetStatuses = new ArrayList<>();

    private Integer minScore;

    private Integer maxScore;

    /**
     * 目标来源，为空表示不限
     */
    private List<LeadSourceEnum> targetSources = new ArrayList<>();

    /**
     * 消息模板，支持 {name} 占位符
     */
    private String messageTemplate;

    /**
     * 允许使用的渠道，为空表示线索的首选渠道
     */
    private List<ChannelEnum> channels = new ArrayList<>();

    private CampaignStatusEnum status;

    private LocalDateTime scheduledAt;

    private LocalDateTime executedAt;

    private int totalTargeted;

    private int totalSent;

    private int totalFailed;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (tenantId == null) {
            throw new IllegalStateException("Tenant ID cannot be null");
        }
        if (messageTemplate == null || messageTemplate.isBlank()) {
            throw new IllegalStateException("Campaign message template cannot be empty");
        }
        if (minScore != null && maxScore != null && minScore > maxScore) {
            throw new IllegalStateException("Campaign minScore cannot exceed maxScore");
        }
    }

    public void complete(int targeted, int sent, int failed, LocalDateTime at) {
        if (status != CampaignStatusEnum.RUNNING) {
            throw new IllegalStateException("Cannot complete campaign from status: " + status);
        }
        this.status = CampaignStatusEnum.COMPLETED;
        this.totalTargeted = targeted;
        this.totalSent = sent;
        this.totalFailed = failed;
        this.executedAt = at;
        this.updatedAt = at;
    }
}
