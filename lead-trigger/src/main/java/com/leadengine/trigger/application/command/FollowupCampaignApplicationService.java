package com.leadengine.trigger.application.command;

import com.leadengine.domain.followup.adapter.gateway.IChannelSender;
import com.leadengine.domain.followup.adapter.repository.IFollowupCampaignRepository;
import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.followup.model.valobj.CampaignRunResult;
import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.trigger.application.common.BoundedRetry;
import com.leadengine.types.enums.CampaignStatusEnum;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.exception.AppException;
import com.leadengine.types.exception.ChannelDeliveryException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 跟进活动写用例：创建活动、执行到期活动。
 * <p>
 * 活动消息不推进线索的自动跟进次数，交互记录带活动 ID。
 * </p>
 */
@Slf4j
@Service
public class FollowupCampaignApplicationService {

    private final IFollowupCampaignRepository followupCampaignRepository;
    private final ILeadRepository leadRepository;
    private final IChannelSender channelSender;
    private final FollowupPolicyDomainService followupPolicyDomainService;
    private final LeadPersistenceApplicationService leadPersistenceApplicationService;
    private final BoundedRetry boundedRetry;
    private final int batchSize;
    private final int maxTargets;
    private final Counter sentCounter;
    private final Counter failedCounter;

    public FollowupCampaignApplicationService(IFollowupCampaignRepository followupCampaignRepository,
                                              ILeadRepository leadRepository,
                                              IChannelSender channelSender,
                                              FollowupPolicyDomainService followupPolicyDomainService,
                                              LeadPersistenceApplicationService leadPersistenceApplicationService,
                                              BoundedRetry boundedRetry,
                                              @Value("${campaign.batch-size:5}") int batchSize,
                                              @Value("${campaign.max-targets:1000}") int maxTargets) {
        this.followupCampaignRepository = followupCampaignRepository;
        this.leadRepository = leadRepository;
        this.channelSender = channelSender;
        this.followupPolicyDomainService = followupPolicyDomainService;
        this.leadPersistenceApplicationService = leadPersistenceApplicationService;
        this.boundedRetry = boundedRetry;
        this.batchSize = batchSize > 0 ? batchSize : 5;
        this.maxTargets = maxTargets > 0 ? maxTargets : 1000;
        this.sentCounter = Counter.builder("lead.campaign.sent.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("lead.campaign.failed.total").register(Metrics.globalRegistry);
    }

    /**
     * 创建活动；给定执行时间时直接进入 scheduled
     */
    public FollowupCampaignEntity create(FollowupCampaignEntity campaign) {
        if (campaign == null) {
            throw AppException.illegalParameter("campaign 不能为空");
        }
        try {
            campaign.validate();
        } catch (IllegalStateException ex) {
            throw AppException.illegalParameter(ex.getMessage());
        }
        campaign.setStatus(campaign.getScheduledAt() == null ? CampaignStatusEnum.DRAFT : CampaignStatusEnum.SCHEDULED);
        FollowupCampaignEntity saved = followupCampaignRepository.save(campaign);
        log.info("Campaign created. campaignId={}, tenantId={}, status={}, scheduledAt={}",
                saved.getId(), saved.getTenantId(), saved.getStatus().getCode(), saved.getScheduledAt());
        return saved;
    }

    public List<CampaignRunResult> runDueCampaigns() {
        List<FollowupCampaignEntity> campaigns = followupCampaignRepository.claimDueCampaigns(batchSize);
        List<CampaignRunResult> results = new ArrayList<>();
        if (campaigns == null) {
            return results;
        }
        for (FollowupCampaignEntity campaign : campaigns) {
            results.add(execute(campaign));
        }
        return results;
    }

    private CampaignRunResult execute(FollowupCampaignEntity campaign) {
        List<LeadEntity> targets = leadRepository.findCampaignTargets(campaign.getTenantId(),
                campaign.getTargetStatuses(), campaign.getMinScore(), campaign.getMaxScore(),
                campaign.getTargetSources(), maxTargets);
        int targeted = 0;
        int sent = 0;
        int failed = 0;
        for (LeadEntity lead : targets) {
            ChannelEnum channel = followupPolicyDomainService.selectChannel(campaign, lead);
            if (channel == null) {
                continue;
            }
            targeted++;
            String text = followupPolicyDomainService.renderCampaignMessage(campaign, lead);
            OutboundMessage message = new OutboundMessage(lead.getId(), channel, lead.channelUserId(channel), text);
            try {
                boundedRetry.run("campaign:" + campaign.getId() + ":" + lead.getId(), () -> channelSender.send(message));
                leadPersistenceApplicationService.recordCampaignDelivered(lead.getId(), campaign.getId(), channel, text,
                        LocalDateTime.now());
                sent++;
                sentCounter.increment();
            } catch (ChannelDeliveryException ex) {
                leadPersistenceApplicationService.recordFailedDelivery(lead, campaign.getId(), channel, text, LocalDateTime.now());
                failed++;
                failedCounter.increment();
            }
        }
        campaign.complete(targeted, sent, failed, LocalDateTime.now());
        followupCampaignRepository.update(campaign);
        log.info("Campaign completed. campaignId={}, tenantId={}, targeted={}, sent={}, failed={}",
                campaign.getId(), campaign.getTenantId(), targeted, sent, failed);
        return new CampaignRunResult(campaign.getId(), targeted, sent, failed);
    }
}
