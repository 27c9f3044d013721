package com.leadengine.domain.lead.adapter.repository;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;

import java.util.List;

/**
 * 线索仓储接口
 */
public interface ILeadRepository {

    /**
     * 保存新线索
     */
    LeadEntity save(LeadEntity entity);

    /**
     * 全量更新（调用方已持有行锁）
     */
    LeadEntity update(LeadEntity entity);

    /**
     * 乐观锁更新，版本不一致时返回 false；不写认领列，跟进认领以存储中的值为准
     */
    boolean updateWithVersion(LeadEntity entity);

    /**
     * 根据 ID 查询
     */
    LeadEntity findById(Long id);

    /**
     * 根据 ID 查询并加行锁，须在事务内调用
     */
    LeadEntity findByIdForUpdate(Long id);

    /**
     * 按外部主页 URL 查询
     */
    LeadEntity findByProfileUrl(Long tenantId, String profileUrl);

    /**
     * 按渠道用户 ID 查询
     */
    LeadEntity findByChannelUserId(Long tenantId, ChannelEnum channel, String channelUserId);

    /**
     * 按手机号查询
     */
    LeadEntity findByPhone(Long tenantId, String phone);

    /**
     * 按租户与状态查询
     */
    List<LeadEntity> findByTenantAndStatuses(Long tenantId, List<LeadStatusEnum> statuses);

    /**
     * 查询活动目标线索：状态、分数区间、来源过滤，且至少有一个可触达渠道
     */
    List<LeadEntity> findCampaignTargets(Long tenantId,
                                                 List<LeadStatusEnum> statuses,
                                                 Integer minScore,
                                                 Integer maxScore,
                                                 List<LeadSourceEnum> sources,
                                                 int limit);

    /**
     * 认领到期待跟进线索（FOR UPDATE SKIP LOCKED），已被其它实例认领的行被跳过
     *
     * @param claimOwner   认领者标识
     * @param limit        最多认领条数
     * @param leaseSeconds 租约秒数，过期后可被重新认领
     */
    List<LeadEntity> claimDueFollowups(String claimOwner, int limit, int leaseSeconds);

    /**
     * 释放认领，仅当认领者与认领次数一致时生效
     */
    boolean releaseClaim(Long id, String claimOwner, int claimAttempt);
}
