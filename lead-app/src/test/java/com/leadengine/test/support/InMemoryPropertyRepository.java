package com.leadengine.test.support;

import com.leadengine.domain.matching.adapter.repository.IPropertyRepository;
import com.leadengine.domain.matching.model.entity.PropertyEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryPropertyRepository implements IPropertyRepository {

    private final Map<Long, PropertyEntity> rows = new LinkedHashMap<>();

    public PropertyEntity put(PropertyEntity property) {
        rows.put(property.getId(), property);
        return property;
    }

    @Override
    public PropertyEntity findById(Long id) {
        return rows.get(id);
    }

    @Override
    public List<PropertyEntity> findAvailableByTenant(Long tenantId) {
        List<PropertyEntity> result = new ArrayList<>();
        for (PropertyEntity property : rows.values()) {
            if (property.isAvailable() && tenantId.equals(property.getTenantId())) {
                result.add(property);
            }
        }
        return result;
    }
}
