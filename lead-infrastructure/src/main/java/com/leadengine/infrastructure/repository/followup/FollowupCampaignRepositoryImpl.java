package com.leadengine.infrastructure.repository.followup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.leadengine.domain.followup.adapter.repository.IFollowupCampaignRepository;
import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.infrastructure.dao.FollowupCampaignDao;
import com.leadengine.infrastructure.dao.po.FollowupCampaignPO;
import com.leadengine.infrastructure.util.JsonCodec;
import com.leadengine.types.enums.CampaignStatusEnum;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 跟进活动仓储实现
 */
@Slf4j
@Repository
public class FollowupCampaignRepositoryImpl implements IFollowupCampaignRepository {

    private final FollowupCampaignDao followupCampaignDao;
    private final JsonCodec jsonCodec;

    public FollowupCampaignRepositoryImpl(FollowupCampaignDao followupCampaignDao, JsonCodec jsonCodec) {
        this.followupCampaignDao = followupCampaignDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public FollowupCampaignEntity save(FollowupCampaignEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        if (entity.getStatus() == null) {
            entity.setStatus(CampaignStatusEnum.DRAFT);
        }
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        FollowupCampaignPO po = toPO(entity);
        followupCampaignDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public FollowupCampaignEntity update(FollowupCampaignEntity entity) {
        entity.validate();
        entity.setUpdatedAt(LocalDateTime.now());
        int affected = followupCampaignDao.update(toPO(entity));
        if (affected == 0) {
            log.warn("Campaign update affected no rows. campaignId={}", entity.getId());
        }
        return entity;
    }

    @Override
    public FollowupCampaignEntity findById(Long id) {
        FollowupCampaignPO po = followupCampaignDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<FollowupCampaignEntity> claimDueCampaigns(int limit) {
        int safeLimit = limit > 0 ? limit : 10;
        return followupCampaignDao.claimDueCampaigns(safeLimit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private FollowupCampaignPO toPO(FollowupCampaignEntity entity) {
        return FollowupCampaignPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .name(entity.getName())
                .targetStatuses(jsonCodec.writeArray(codes(entity.getTargetStatuses(), LeadStatusEnum::getCode)))
                .minScore(entity.getMinScore())
                .maxScore(entity.getMaxScore())
                .targetSources(jsonCodec.writeArray(codes(entity.getTargetSources(), LeadSourceEnum::getCode)))
                .messageTemplate(entity.getMessageTemplate())
                .channels(jsonCodec.writeArray(codes(entity.getChannels(), ChannelEnum::getCode)))
                .status(entity.getStatus().getCode())
                .scheduledAt(entity.getScheduledAt())
                .executedAt(entity.getExecutedAt())
                .totalTargeted(entity.getTotalTargeted())
                .totalSent(entity.getTotalSent())
                .totalFailed(entity.getTotalFailed())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private FollowupCampaignEntity toEntity(FollowupCampaignPO po) {
        FollowupCampaignEntity entity = new FollowupCampaignEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setName(po.getName());
        entity.setTargetStatuses(values(po.getTargetStatuses(), LeadStatusEnum::fromCode));
        entity.setMinScore(po.getMinScore());
        entity.setMaxScore(po.getMaxScore());
        entity.setTargetSources(values(po.getTargetSources(), LeadSourceEnum::fromCode));
        entity.setMessageTemplate(po.getMessageTemplate());
        entity.setChannels(values(po.getChannels(), ChannelEnum::fromCode));
        entity.setStatus(CampaignStatusEnum.fromCode(po.getStatus()));
        entity.setScheduledAt(po.getScheduledAt());
        entity.setExecutedAt(po.getExecutedAt());
        entity.setTotalTargeted(po.getTotalTargeted() == null ? 0 : po.getTotalTargeted());
        entity.setTotalSent(po.getTotalSent() == null ? 0 : po.getTotalSent());
        entity.setTotalFailed(po.getTotalFailed() == null ? 0 : po.getTotalFailed());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private <E> List<String> codes(List<E> values, Function<E, String> codeOf) {
        if (values == null) {
            return new ArrayList<>();
        }
        return values.stream().map(codeOf).collect(Collectors.toList());
    }

    private <E> List<E> values(String json, Function<String, E> fromCode) {
        List<String> codes = jsonCodec.readValue(json, new TypeReference<List<String>>() {});
        if (codes == null) {
            return new ArrayList<>();
        }
        return codes.stream().map(fromCode).collect(Collectors.toList());
    }
}
