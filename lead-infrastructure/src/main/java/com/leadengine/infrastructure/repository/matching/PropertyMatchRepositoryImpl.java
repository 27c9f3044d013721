package com.leadengine.infrastructure.repository.matching;

import com.leadengine.domain.matching.adapter.repository.IPropertyMatchRepository;
import com.leadengine.domain.matching.model.entity.PropertyMatchRecordEntity;
import com.leadengine.infrastructure.dao.PropertyMatchDao;
import com.leadengine.infrastructure.dao.po.PropertyMatchPO;
import com.leadengine.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 匹配记录仓储实现，依赖 (property_id, lead_id) 唯一约束做幂等插入。
 */
@Repository
public class PropertyMatchRepositoryImpl implements IPropertyMatchRepository {

    private final PropertyMatchDao propertyMatchDao;
    private final JsonCodec jsonCodec;

    public PropertyMatchRepositoryImpl(PropertyMatchDao propertyMatchDao, JsonCodec jsonCodec) {
        this.propertyMatchDao = propertyMatchDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public boolean insertIfAbsent(PropertyMatchRecordEntity entity) {
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        PropertyMatchPO po = PropertyMatchPO.builder()
                .propertyId(entity.getPropertyId())
                .leadId(entity.getLeadId())
                .tenantId(entity.getTenantId())
                .matchScore(entity.getMatchScore())
                .matchReasons(jsonCodec.writeArray(entity.getMatchReasons()))
                .notified(Boolean.FALSE)
                .createdAt(entity.getCreatedAt())
                .build();
        boolean inserted = propertyMatchDao.insertIgnoreConflict(po) > 0;
        if (inserted) {
            entity.setId(po.getId());
        }
        return inserted;
    }

    @Override
    public boolean markNotified(Long propertyId, Long leadId, LocalDateTime notifiedAt) {
        return propertyMatchDao.markNotified(propertyId, leadId, notifiedAt) > 0;
    }

    @Override
    public List<PropertyMatchRecordEntity> findByPropertyId(Long propertyId) {
        return propertyMatchDao.selectByPropertyId(propertyId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private PropertyMatchRecordEntity toEntity(PropertyMatchPO po) {
        PropertyMatchRecordEntity entity = new PropertyMatchRecordEntity();
        entity.setId(po.getId());
        entity.setPropertyId(po.getPropertyId());
        entity.setLeadId(po.getLeadId());
        entity.setTenantId(po.getTenantId());
        entity.setMatchScore(po.getMatchScore() == null ? 0D : po.getMatchScore());
        entity.setMatchReasons(jsonCodec.readStringList(po.getMatchReasons()));
        entity.setNotified(Boolean.TRUE.equals(po.getNotified()));
        entity.setNotifiedAt(po.getNotifiedAt());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
