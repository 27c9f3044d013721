package com.leadengine.domain.matching.adapter.repository;

import com.leadengine.domain.matching.model.entity.PropertyEntity;

import java.util.List;

/**
 * 房源只读仓储
 */
public interface IPropertyRepository {

    /**
     * 根据 ID 查询
     */
    PropertyEntity findById(Long id);

    /**
     * 查询租户下可售/可租房源
     */
    List<PropertyEntity> findAvailableByTenant(Long tenantId);
}
