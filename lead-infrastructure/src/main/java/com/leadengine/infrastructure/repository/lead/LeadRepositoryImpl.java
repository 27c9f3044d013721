package com.leadengine.infrastructure.repository.lead;

import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.infrastructure.dao.LeadDao;
import com.leadengine.infrastructure.dao.po.LeadPO;
import com.leadengine.infrastructure.util.JsonCodec;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationSlotEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.FollowupStageEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.LeadGradeEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.enums.PaymentMethodEnum;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.PurposeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 线索仓储实现：Entity 与 PO 互转，枚举以编码落库，集合字段以 JSONB 落库。
 */
@Slf4j
@Repository
public class LeadRepositoryImpl implements ILeadRepository {

    private final LeadDao leadDao;
    private final JsonCodec jsonCodec;

    public LeadRepositoryImpl(LeadDao leadDao, JsonCodec jsonCodec) {
        this.leadDao = leadDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public LeadEntity save(LeadEntity entity) {
        entity.validate();
        LeadPO po = toPO(entity);
        leadDao.insert(po);
        entity.setId(po.getId());
        entity.setVersion(0);
        return entity;
    }

    @Override
    public LeadEntity update(LeadEntity entity) {
        entity.validate();
        LeadPO po = toPO(entity);
        int affected = leadDao.update(po);
        if (affected == 0) {
            log.warn("Lead update affected no rows. leadId={}", entity.getId());
        } else {
            entity.setVersion(nextVersion(entity.getVersion()));
        }
        return entity;
    }

    @Override
    public boolean updateWithVersion(LeadEntity entity) {
        entity.validate();
        LeadPO po = toPO(entity);
        boolean updated = leadDao.updateWithVersion(po) > 0;
        if (updated) {
            entity.setVersion(nextVersion(entity.getVersion()));
        }
        return updated;
    }

    @Override
    public LeadEntity findById(Long id) {
        return toEntity(leadDao.selectById(id));
    }

    @Override
    public LeadEntity findByIdForUpdate(Long id) {
        return toEntity(leadDao.selectByIdForUpdate(id));
    }

    @Override
    public LeadEntity findByProfileUrl(Long tenantId, String profileUrl) {
        return toEntity(leadDao.selectByProfileUrl(tenantId, profileUrl));
    }

    @Override
    public LeadEntity findByChannelUserId(Long tenantId, ChannelEnum channel, String channelUserId) {
        if (channel == ChannelEnum.TELEGRAM) {
            return toEntity(leadDao.selectByTelegramUserId(tenantId, channelUserId));
        }
        if (channel == ChannelEnum.WHATSAPP) {
            return toEntity(leadDao.selectByWhatsappUserId(tenantId, channelUserId));
        }
        return null;
    }

    @Override
    public LeadEntity findByPhone(Long tenantId, String phone) {
        return toEntity(leadDao.selectByPhone(tenantId, phone));
    }

    @Override
    public List<LeadEntity> findByTenantAndStatuses(Long tenantId, List<LeadStatusEnum> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> codes = statuses.stream().map(LeadStatusEnum::getCode).collect(Collectors.toList());
        return leadDao.selectByTenantAndStatuses(tenantId, codes).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<LeadEntity> findCampaignTargets(Long tenantId,
                                                List<LeadStatusEnum> statuses,
                                                Integer minScore,
                                                Integer maxScore,
                                                List<LeadSourceEnum> sources,
                                                int limit) {
        List<String> statusCodes = statuses == null || statuses.isEmpty()
                ? List.of(LeadStatusEnum.OPEN.getCode())
                : statuses.stream().map(LeadStatusEnum::getCode).collect(Collectors.toList());
        List<String> sourceCodes = sources == null || sources.isEmpty()
                ? null
                : sources.stream().map(LeadSourceEnum::getCode).collect(Collectors.toList());
        return leadDao.selectCampaignTargets(tenantId, statusCodes, minScore, maxScore, sourceCodes, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<LeadEntity> claimDueFollowups(String claimOwner, int limit, int leaseSeconds) {
        return leadDao.claimDueFollowups(claimOwner, limit, leaseSeconds, FollowupStageEnum.MAX_FOLLOWUPS).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean releaseClaim(Long id, String claimOwner, int claimAttempt) {
        return leadDao.releaseClaim(id, claimOwner, claimAttempt) > 0;
    }

    private LeadEntity toEntity(LeadPO po) {
        if (po == null) {
            return null;
        }
        LeadEntity entity = new LeadEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setName(po.getName());
        entity.setEmail(po.getEmail());
        entity.setJobTitle(po.getJobTitle());
        entity.setCompany(po.getCompany());
        entity.setProfileUrl(po.getProfileUrl());
        entity.setTelegramUserId(po.getTelegramUserId());
        entity.setWhatsappUserId(po.getWhatsappUserId());
        entity.setPhone(po.getPhone());
        entity.setSource(LeadSourceEnum.fromCode(po.getSource()));
        entity.setStatus(LeadStatusEnum.fromCode(po.getStatus()));

        entity.setTransactionType(TransactionTypeEnum.fromCode(po.getTransactionType()));
        entity.setPropertyType(PropertyTypeEnum.fromCode(po.getPropertyType()));
        entity.setBudgetMin(po.getBudgetMin());
        entity.setBudgetMax(po.getBudgetMax());
        entity.setBedroomsMin(po.getBedroomsMin());
        entity.setBedroomsMax(po.getBedroomsMax());
        entity.setPreferredLocations(jsonCodec.readStringSet(po.getPreferredLocations()));
        entity.setPurpose(PurposeEnum.fromCode(po.getPurpose()));
        entity.setPaymentMethod(PaymentMethodEnum.fromCode(po.getPaymentMethod()));

        entity.setConversationState(ConversationStateEnum.fromCode(po.getConversationState()));
        entity.setPendingSlot(ConversationSlotEnum.fromCode(po.getPendingSlot()));
        entity.setFilledSlots(jsonCodec.readFlagMap(po.getFilledSlots()));
        entity.setLanguage(LanguageEnum.fromCode(po.getLanguage()));
        entity.setConversationData(jsonCodec.readMap(po.getConversationData()));

        entity.setMessagesSent(intValue(po.getMessagesSent()));
        entity.setMessagesReceived(intValue(po.getMessagesReceived()));
        entity.setLastActiveAt(po.getLastActiveAt());
        entity.setLastContactedAt(po.getLastContactedAt());

        entity.setNextFollowupAt(po.getNextFollowupAt());
        entity.setFollowupCount(intValue(po.getFollowupCount()));
        entity.setFailedFollowupCycles(intValue(po.getFailedFollowupCycles()));

        entity.setScore(intValue(po.getScore()));
        entity.setGrade(po.getGrade() == null ? null : LeadGradeEnum.fromCode(po.getGrade()));

        entity.setMatchedPropertyIds(jsonCodec.readLongSet(po.getMatchedPropertyIds()));
        entity.setViewedPropertyIds(jsonCodec.readLongSet(po.getViewedPropertyIds()));
        entity.setFavoritedPropertyIds(jsonCodec.readLongSet(po.getFavoritedPropertyIds()));

        entity.setClaimOwner(po.getClaimOwner());
        entity.setClaimExpiresAt(po.getClaimExpiresAt());
        entity.setClaimAttempt(intValue(po.getClaimAttempt()));
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private LeadPO toPO(LeadEntity entity) {
        return LeadPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .name(entity.getName())
                .email(entity.getEmail())
                .jobTitle(entity.getJobTitle())
                .company(entity.getCompany())
                .profileUrl(entity.getProfileUrl())
                .telegramUserId(entity.getTelegramUserId())
                .whatsappUserId(entity.getWhatsappUserId())
                .phone(entity.getPhone())
                .source(entity.getSource() == null ? null : entity.getSource().getCode())
                .status(entity.getStatus() == null ? LeadStatusEnum.OPEN.getCode() : entity.getStatus().getCode())
                .transactionType(entity.getTransactionType() == null ? null : entity.getTransactionType().getCode())
                .propertyType(entity.getPropertyType() == null ? null : entity.getPropertyType().getCode())
                .budgetMin(entity.getBudgetMin())
                .budgetMax(entity.getBudgetMax())
                .bedroomsMin(entity.getBedroomsMin())
                .bedroomsMax(entity.getBedroomsMax())
                .preferredLocations(jsonCodec.writeArray(entity.getPreferredLocations()))
                .purpose(entity.getPurpose() == null ? null : entity.getPurpose().getCode())
                .paymentMethod(entity.getPaymentMethod() == null ? null : entity.getPaymentMethod().getCode())
                .conversationState(entity.getConversationState() == null ? null : entity.getConversationState().getCode())
                .pendingSlot(entity.getPendingSlot() == null ? null : entity.getPendingSlot().getCode())
                .filledSlots(jsonCodec.writeValue(entity.getFilledSlots() == null ? Collections.emptyMap() : entity.getFilledSlots()))
                .language(entity.getLanguage() == null ? null : entity.getLanguage().getCode())
                .conversationData(jsonCodec.writeValue(entity.getConversationData() == null ? Collections.emptyMap() : entity.getConversationData()))
                .messagesSent(entity.getMessagesSent())
                .messagesReceived(entity.getMessagesReceived())
                .lastActiveAt(entity.getLastActiveAt())
                .lastContactedAt(entity.getLastContactedAt())
                .nextFollowupAt(entity.getNextFollowupAt())
                .followupCount(entity.getFollowupCount())
                .failedFollowupCycles(entity.getFailedFollowupCycles())
                .score(entity.getScore())
                .grade(entity.getGrade() == null ? null : entity.getGrade().getCode())
                .matchedPropertyIds(jsonCodec.writeArray(entity.getMatchedPropertyIds()))
                .viewedPropertyIds(jsonCodec.writeArray(entity.getViewedPropertyIds()))
                .favoritedPropertyIds(jsonCodec.writeArray(entity.getFavoritedPropertyIds()))
                .claimOwner(entity.getClaimOwner())
                .claimExpiresAt(entity.getClaimExpiresAt())
                .claimAttempt(entity.getClaimAttempt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private Integer nextVersion(Integer version) {
        return version == null ? 1 : version + 1;
    }

    private int intValue(Integer value) {
        return value == null ? 0 : value;
    }
}
