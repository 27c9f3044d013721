package com.leadengine.trigger.application.command;

import com.leadengine.domain.followup.adapter.gateway.IChannelSender;
import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.matching.adapter.repository.IPropertyMatchRepository;
import com.leadengine.domain.matching.adapter.repository.IPropertyRepository;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.domain.matching.model.entity.PropertyMatchRecordEntity;
import com.leadengine.domain.matching.model.valobj.MatchEvaluation;
import com.leadengine.domain.matching.service.PropertyMatchDomainService;
import com.leadengine.trigger.application.common.BoundedRetry;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.exception.AppException;
import com.leadengine.types.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 新房源匹配通知：先插入匹配记录作为通知权，插入成功才投递，每个 (房源, 线索) 最多通知一次。
 * <p>
 * 投递失败的记录保持未通知状态，之后不会再次投递。
 * </p>
 */
@Slf4j
@Service
public class PropertyMatchNotifyApplicationService {

    private static final List<LeadStatusEnum> CANDIDATE_STATUSES = List.of(LeadStatusEnum.OPEN, LeadStatusEnum.NURTURING);

    private final IPropertyRepository propertyRepository;
    private final IPropertyMatchRepository propertyMatchRepository;
    private final ILeadRepository leadRepository;
    private final PropertyMatchDomainService propertyMatchDomainService;
    private final FollowupPolicyDomainService followupPolicyDomainService;
    private final IChannelSender channelSender;
    private final BoundedRetry boundedRetry;
    private final LeadPersistenceApplicationService leadPersistenceApplicationService;

    public PropertyMatchNotifyApplicationService(IPropertyRepository propertyRepository,
                                                 IPropertyMatchRepository propertyMatchRepository,
                                                 ILeadRepository leadRepository,
                                                 PropertyMatchDomainService propertyMatchDomainService,
                                                 FollowupPolicyDomainService followupPolicyDomainService,
                                                 IChannelSender channelSender,
                                                 BoundedRetry boundedRetry,
                                                 LeadPersistenceApplicationService leadPersistenceApplicationService) {
        this.propertyRepository = propertyRepository;
        this.propertyMatchRepository = propertyMatchRepository;
        this.leadRepository = leadRepository;
        this.propertyMatchDomainService = propertyMatchDomainService;
        this.followupPolicyDomainService = followupPolicyDomainService;
        this.channelSender = channelSender;
        this.boundedRetry = boundedRetry;
        this.leadPersistenceApplicationService = leadPersistenceApplicationService;
    }

    public NotifyResult notifyMatches(Long propertyId) {
        if (propertyId == null) {
            throw AppException.illegalParameter("propertyId 不能为空");
        }
        PropertyEntity property = propertyRepository.findById(propertyId);
        if (property == null) {
            throw AppException.notFound("Property not found: " + propertyId);
        }
        if (!property.isAvailable()) {
            log.info("Skip match notification for unavailable property. propertyId={}", propertyId);
            return new NotifyResult(propertyId, 0, 0, 0, 0);
        }

        List<LeadEntity> candidates = leadRepository.findByTenantAndStatuses(property.getTenantId(), CANDIDATE_STATUSES);
        Map<Long, LeadEntity> byId = candidates.stream()
                .collect(Collectors.toMap(LeadEntity::getId, Function.identity(), (left, right) -> left));
        List<Long> matchedIds = propertyMatchDomainService.matchForProperty(property, candidates);

        int notified = 0;
        int skipped = 0;
        int failed = 0;
        for (Long leadId : matchedIds) {
            LeadEntity lead = byId.get(leadId);
            MatchEvaluation evaluation = propertyMatchDomainService.evaluate(lead, property);
            if (!propertyMatchRepository.insertIfAbsent(toRecord(property, lead, evaluation))) {
                skipped++;
                continue;
            }
            ChannelEnum channel = lead.reachableChannel();
            String text = followupPolicyDomainService.renderPropertyMatchMessage(lead, property);
            OutboundMessage message = new OutboundMessage(leadId, channel, lead.channelUserId(channel), text);
            try {
                boundedRetry.run("match:" + propertyId + ":" + leadId, () -> channelSender.send(message));
            } catch (ChannelDeliveryException ex) {
                leadPersistenceApplicationService.recordFailedDelivery(lead, null, channel, text, LocalDateTime.now());
                failed++;
                continue;
            }
            leadPersistenceApplicationService.recordMatchNotified(leadId, propertyId, channel, text, LocalDateTime.now());
            notified++;
        }
        log.info("Property match notification finished. propertyId={}, tenantId={}, matched={}, notified={}, skipped={}, failed={}",
                propertyId, property.getTenantId(), matchedIds.size(), notified, skipped, failed);
        return new NotifyResult(propertyId, matchedIds.size(), notified, skipped, failed);
    }

    private PropertyMatchRecordEntity toRecord(PropertyEntity property, LeadEntity lead, MatchEvaluation evaluation) {
        PropertyMatchRecordEntity record = new PropertyMatchRecordEntity();
        record.setPropertyId(property.getId());
        record.setLeadId(lead.getId());
        record.setTenantId(property.getTenantId());
        record.setMatchScore(evaluation.score());
        record.setMatchReasons(evaluation.reasons());
        record.setCreatedAt(LocalDateTime.now());
        return record;
    }

    /**
     * @param matched  匹配到的线索数
     * @param notified 本次通知成功数
     * @param skipped  已有匹配记录而跳过的数
     * @param failed   投递失败数
     */
    public record NotifyResult(Long propertyId, int matched, int notified, int skipped, int failed) {
    }
}
