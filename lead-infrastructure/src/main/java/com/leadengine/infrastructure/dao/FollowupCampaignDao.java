package com.leadengine.infrastructure.dao;

import com.leadengine.infrastructure.dao.po.FollowupCampaignPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 跟进活动 DAO
 */
@Mapper
public interface FollowupCampaignDao {

    int insert(FollowupCampaignPO po);

    int update(FollowupCampaignPO po);

    FollowupCampaignPO selectById(@Param("id") Long id);

    /**
     * 认领到期活动并置为 running
     */
    List<FollowupCampaignPO> claimDueCampaigns(@Param("limit") Integer limit);
}
