package com.leadengine.infrastructure.repository.lead;

import com.leadengine.domain.lead.adapter.repository.ILeadInteractionRepository;
import com.leadengine.domain.lead.model.entity.LeadInteractionEntity;
import com.leadengine.infrastructure.dao.LeadInteractionDao;
import com.leadengine.infrastructure.dao.po.LeadInteractionPO;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.DeliveryStatusEnum;
import com.leadengine.types.enums.InteractionDirectionEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 交互记录仓储实现
 */
@Repository
public class LeadInteractionRepositoryImpl implements ILeadInteractionRepository {

    private final LeadInteractionDao leadInteractionDao;

    public LeadInteractionRepositoryImpl(LeadInteractionDao leadInteractionDao) {
        this.leadInteractionDao = leadInteractionDao;
    }

    @Override
    public LeadInteractionEntity append(LeadInteractionEntity entity) {
        entity.validate();
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        LeadInteractionPO po = toPO(entity);
        leadInteractionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<LeadInteractionEntity> findRecentByLeadId(Long leadId, int limit) {
        int safeLimit = limit > 0 ? limit : 20;
        return leadInteractionDao.selectRecentByLeadId(leadId, safeLimit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private LeadInteractionPO toPO(LeadInteractionEntity entity) {
        return LeadInteractionPO.builder()
                .id(entity.getId())
                .leadId(entity.getLeadId())
                .tenantId(entity.getTenantId())
                .channel(entity.getChannel().getCode())
                .direction(entity.getDirection().getCode())
                .text(entity.getText())
                .automated(entity.isAutomated())
                .deliveryStatus(entity.getDeliveryStatus() == null ? null : entity.getDeliveryStatus().getCode())
                .campaignId(entity.getCampaignId())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private LeadInteractionEntity toEntity(LeadInteractionPO po) {
        LeadInteractionEntity entity = new LeadInteractionEntity();
        entity.setId(po.getId());
        entity.setLeadId(po.getLeadId());
        entity.setTenantId(po.getTenantId());
        entity.setChannel(ChannelEnum.fromCode(po.getChannel()));
        entity.setDirection(InteractionDirectionEnum.fromCode(po.getDirection()));
        entity.setText(po.getText());
        entity.setAutomated(Boolean.TRUE.equals(po.getAutomated()));
        entity.setDeliveryStatus(DeliveryStatusEnum.fromCode(po.getDeliveryStatus()));
        entity.setCampaignId(po.getCampaignId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
