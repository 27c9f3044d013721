package com.leadengine.domain.matching.adapter.repository;

import com.leadengine.domain.matching.model.entity.PropertyMatchRecordEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 匹配记录仓储
 */
public interface IPropertyMatchRepository {

    /**
     * 插入匹配记录，(propertyId, leadId) 已存在时不做任何修改
     *
     * @return 是否由本次调用插入
     */
    boolean insertIfAbsent(PropertyMatchRecordEntity entity);

    /**
     * 标记已通知
     */
    boolean markNotified(Long propertyId, Long leadId, LocalDateTime notifiedAt);

    /**
     * 按房源查询匹配记录
     */
    List<PropertyMatchRecordEntity> findByPropertyId(Long propertyId);
}
