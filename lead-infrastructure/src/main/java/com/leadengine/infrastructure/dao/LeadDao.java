package com.leadengine.infrastructure.dao;

import com.leadengine.infrastructure.dao.po.LeadPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 线索 DAO
 */
@Mapper
public interface LeadDao {

    /**
     * 插入线索
     */
    int insert(LeadPO po);

    /**
     * 全量更新，版本号自增
     */
    int update(LeadPO po);

    /**
     * 乐观锁更新
     */
    int updateWithVersion(LeadPO po);

    /**
     * 根据 ID 查询
     */
    LeadPO selectById(@Param("id") Long id);

    /**
     * 根据 ID 查询并加行锁
     */
    LeadPO selectByIdForUpdate(@Param("id") Long id);

    LeadPO selectByProfileUrl(@Param("tenantId") Long tenantId,
                              @Param("profileUrl") String profileUrl);

    LeadPO selectByTelegramUserId(@Param("tenantId") Long tenantId,
                                  @Param("telegramUserId") String telegramUserId);

    LeadPO selectByWhatsappUserId(@Param("tenantId") Long tenantId,
                                  @Param("whatsappUserId") String whatsappUserId);

    LeadPO selectByPhone(@Param("tenantId") Long tenantId,
                         @Param("phone") String phone);

    /**
     * 按租户与状态查询
     */
    List<LeadPO> selectByTenantAndStatuses(@Param("tenantId") Long tenantId,
                                           @Param("statuses") List<String> statuses);

    /**
     * 查询活动目标线索
     */
    List<LeadPO> selectCampaignTargets(@Param("tenantId") Long tenantId,
                                       @Param("statuses") List<String> statuses,
                                       @Param("minScore") Integer minScore,
                                       @Param("maxScore") Integer maxScore,
                                       @Param("sources") List<String> sources,
                                       @Param("limit") Integer limit);

    /**
     * 认领到期待跟进线索（FOR UPDATE SKIP LOCKED）
     */
    List<LeadPO> claimDueFollowups(@Param("claimOwner") String claimOwner,
                                   @Param("limit") Integer limit,
                                   @Param("leaseSeconds") Integer leaseSeconds,
                                   @Param("maxFollowups") Integer maxFollowups);

    /**
     * 释放认领
     */
    int releaseClaim(@Param("id") Long id,
                     @Param("claimOwner") String claimOwner,
                     @Param("claimAttempt") Integer claimAttempt);
}
