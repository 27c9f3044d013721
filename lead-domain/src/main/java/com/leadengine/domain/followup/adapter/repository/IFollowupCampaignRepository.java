package com.leadengine.domain.followup.adapter.repository;

import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;

import java.util.List;

/**
 * 跟进活动仓储接口
 */
public interface IFollowupCampaignRepository {

    /**
     * 保存活动
     */
    FollowupCampaignEntity save(FollowupCampaignEntity entity);

    /**
     * 更新活动
     */
    FollowupCampaignEntity update(FollowupCampaignEntity entity);

    /**
     * 根据 ID 查询
     */
    FollowupCampaignEntity findById(Long id);

    /**
     * 认领已到执行时间的 scheduled 活动并置为 running（SKIP LOCKED）
     */
    List<FollowupCampaignEntity> claimDueCampaigns(int limit);
}
