package com.leadengine.trigger.application.command;

import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.LeadResolution;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.domain.lead.service.LeadIdentityDomainService;
import com.leadengine.domain.lead.service.LeadScoringDomainService;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 线索识别写用例：按 profileUrl -> 渠道用户 ID -> 手机号 的优先级查找，命中则补全空字段，否则新建。
 * <p>
 * 并发新建由唯一索引兜底，插入冲突时重新查找并按补全处理。
 * </p>
 */
@Slf4j
@Service
public class LeadResolveApplicationService {

    private final ILeadRepository leadRepository;
    private final LeadIdentityDomainService leadIdentityDomainService;
    private final LeadScoringDomainService leadScoringDomainService;

    public LeadResolveApplicationService(ILeadRepository leadRepository,
                                         LeadIdentityDomainService leadIdentityDomainService,
                                         LeadScoringDomainService leadScoringDomainService) {
        this.leadRepository = leadRepository;
        this.leadIdentityDomainService = leadIdentityDomainService;
        this.leadScoringDomainService = leadScoringDomainService;
    }

    public LeadResolution resolve(Long tenantId, ObservedLeadFields observed) {
        ObservedLeadFields normalized = leadIdentityDomainService.normalize(tenantId, observed);
        LeadEntity existing = findExisting(tenantId, normalized);
        if (existing != null) {
            return new LeadResolution(mergeExisting(existing, normalized), false);
        }

        LeadEntity lead = leadIdentityDomainService.newLead(tenantId, normalized, LocalDateTime.now());
        leadScoringDomainService.rescore(lead);
        try {
            leadRepository.save(lead);
        } catch (DuplicateKeyException ex) {
            LeadEntity winner = findExisting(tenantId, normalized);
            if (winner == null) {
                throw ex;
            }
            log.info("Lead creation raced with another writer, merging into existing. tenantId={}, leadId={}",
                    tenantId, winner.getId());
            return new LeadResolution(mergeExisting(winner, normalized), false);
        }
        log.info("Lead created. tenantId={}, leadId={}, source={}", tenantId, lead.getId(),
                lead.getSource() == null ? null : lead.getSource().getCode());
        return new LeadResolution(lead, true);
    }

    private LeadEntity findExisting(Long tenantId, ObservedLeadFields observed) {
        if (observed.getProfileUrl() != null) {
            LeadEntity lead = leadRepository.findByProfileUrl(tenantId, observed.getProfileUrl());
            if (lead != null) {
                return lead;
            }
        }
        if (observed.getChannelUserId() != null) {
            LeadEntity lead = leadRepository.findByChannelUserId(tenantId, observed.getChannel(), observed.getChannelUserId());
            if (lead != null) {
                return lead;
            }
        }
        if (observed.getPhone() != null) {
            return leadRepository.findByPhone(tenantId, observed.getPhone());
        }
        return null;
    }

    private LeadEntity mergeExisting(LeadEntity lead, ObservedLeadFields observed) {
        LeadEntity current = lead;
        for (int attempt = 1; attempt <= 2; attempt++) {
            ObservedLeadFields mergeable = withoutForeignKeys(current, observed);
            if (!leadIdentityDomainService.mergeInto(current, mergeable)) {
                return current;
            }
            leadScoringDomainService.rescore(current);
            current.setUpdatedAt(LocalDateTime.now());
            if (leadRepository.updateWithVersion(current)) {
                return current;
            }
            current = leadRepository.findById(lead.getId());
            if (current == null) {
                throw AppException.notFound("Lead not found: " + lead.getId());
            }
        }
        throw new AppException(ResponseCode.CONCURRENT_MODIFICATION.getCode(),
                "Lead was modified concurrently: " + lead.getId());
    }

    /**
     * 去掉已归属其它线索的身份键，避免补全违反租户内唯一约束
     */
    private ObservedLeadFields withoutForeignKeys(LeadEntity lead, ObservedLeadFields observed) {
        Long tenantId = lead.getTenantId();
        String profileUrl = observed.getProfileUrl();
        if (profileUrl != null && StringUtils.isBlank(lead.getProfileUrl())
                && ownedByOther(lead, leadRepository.findByProfileUrl(tenantId, profileUrl))) {
            log.info("Skip merging profile url owned by another lead. leadId={}", lead.getId());
            profileUrl = null;
        }
        String channelUserId = observed.getChannelUserId();
        if (channelUserId != null && StringUtils.isBlank(lead.channelUserId(observed.getChannel()))
                && ownedByOther(lead, leadRepository.findByChannelUserId(tenantId, observed.getChannel(), channelUserId))) {
            log.info("Skip merging channel user id owned by another lead. leadId={}, channel={}",
                    lead.getId(), observed.getChannel().getCode());
            channelUserId = null;
        }
        String phone = observed.getPhone();
        if (phone != null && StringUtils.isBlank(lead.getPhone())
                && ownedByOther(lead, leadRepository.findByPhone(tenantId, phone))) {
            log.info("Skip merging phone owned by another lead. leadId={}", lead.getId());
            phone = null;
        }
        return ObservedLeadFields.builder()
                .channel(observed.getChannel())
                .channelUserId(channelUserId)
                .profileUrl(profileUrl)
                .phone(phone)
                .name(observed.getName())
                .email(observed.getEmail())
                .jobTitle(observed.getJobTitle())
                .company(observed.getCompany())
                .source(observed.getSource())
                .language(observed.getLanguage())
                .build();
    }

    private boolean ownedByOther(LeadEntity lead, LeadEntity owner) {
        return owner != null && !owner.getId().equals(lead.getId());
    }
}
