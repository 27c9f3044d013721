package com.leadengine.domain.lead.adapter.repository;

import com.leadengine.domain.lead.model.entity.LeadInteractionEntity;

import java.util.List;

/**
 * 线索交互记录仓储，仅支持追加与查询。
 */
public interface ILeadInteractionRepository {

    /**
     * 追加一条交互记录
     */
    LeadInteractionEntity append(LeadInteractionEntity entity);

    /**
     * 按线索查询最近的交互记录，按时间倒序
     */
    List<LeadInteractionEntity> findRecentByLeadId(Long leadId, int limit);
}
