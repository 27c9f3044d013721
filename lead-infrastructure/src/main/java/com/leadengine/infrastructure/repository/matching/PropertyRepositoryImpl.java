package com.leadengine.infrastructure.repository.matching;

import com.leadengine.domain.matching.adapter.repository.IPropertyRepository;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.infrastructure.dao.PropertyDao;
import com.leadengine.infrastructure.dao.po.PropertyPO;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

@Repository
public class PropertyRepositoryImpl implements IPropertyRepository {

    private final PropertyDao propertyDao;

    public PropertyRepositoryImpl(PropertyDao propertyDao) {
        this.propertyDao = propertyDao;
    }

    @Override
    public PropertyEntity findById(Long id) {
        PropertyPO po = propertyDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<PropertyEntity> findAvailableByTenant(Long tenantId) {
        return propertyDao.selectAvailableByTenant(tenantId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private PropertyEntity toEntity(PropertyPO po) {
        PropertyEntity entity = new PropertyEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setName(po.getName());
        entity.setPrice(po.getPrice());
        entity.setPropertyType(PropertyTypeEnum.fromCode(po.getPropertyType()));
        entity.setTransactionType(TransactionTypeEnum.fromCode(po.getTransactionType()));
        entity.setLocation(po.getLocation());
        entity.setBedrooms(po.getBedrooms());
        entity.setAvailable(Boolean.TRUE.equals(po.getIsAvailable()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
