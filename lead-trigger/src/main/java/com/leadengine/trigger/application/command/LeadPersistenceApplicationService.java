package com.leadengine.trigger.application.command;

import com.leadengine.domain.conversation.model.valobj.AdvanceResult;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.adapter.repository.ILeadInteractionRepository;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.entity.LeadInteractionEntity;
import com.leadengine.domain.lead.service.LeadScoringDomainService;
import com.leadengine.domain.matching.adapter.repository.IPropertyMatchRepository;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.InteractionDirectionEnum;
import com.leadengine.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 线索写用例的事务边界。
 * <p>
 * 调度路径先对线索加行锁再校验认领，会话路径使用乐观版本号；
 * 交互记录与线索字段变更在同一事务内提交，评分在每次写入前重算。
 * </p>
 */
@Slf4j
@Service
public class LeadPersistenceApplicationService {

    private final ILeadRepository leadRepository;
    private final ILeadInteractionRepository leadInteractionRepository;
    private final IPropertyMatchRepository propertyMatchRepository;
    private final LeadScoringDomainService leadScoringDomainService;
    private final FollowupPolicyDomainService followupPolicyDomainService;
    private final Duration followupInterval;
    private final int maxFailedCycles;

    public LeadPersistenceApplicationService(ILeadRepository leadRepository,
                                             ILeadInteractionRepository leadInteractionRepository,
                                             IPropertyMatchRepository propertyMatchRepository,
                                             LeadScoringDomainService leadScoringDomainService,
                                             FollowupPolicyDomainService followupPolicyDomainService,
                                             @Value("${followup.interval-days:3}") long intervalDays,
                                             @Value("${followup.max-failed-cycles:5}") int maxFailedCycles) {
        this.leadRepository = leadRepository;
        this.leadInteractionRepository = leadInteractionRepository;
        this.propertyMatchRepository = propertyMatchRepository;
        this.leadScoringDomainService = leadScoringDomainService;
        this.followupPolicyDomainService = followupPolicyDomainService;
        this.followupInterval = Duration.ofDays(intervalDays > 0 ? intervalDays : 3);
        this.maxFailedCycles = maxFailedCycles > 0 ? maxFailedCycles : 5;
    }

    /**
     * 提交一轮会话：入站计数、字段变更、回复计数、沉默计时重启与评分，版本冲突时返回 false 且不写任何数据
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean persistConversationTurn(LeadEntity lead,
                                           ChannelEnum channel,
                                           String inboundText,
                                           AdvanceResult result,
                                           LocalDateTime now) {
        lead.recordInbound(now);
        skipForeignPhone(lead, result);
        result.applyTo(lead);
        boolean hasReply = StringUtils.isNotBlank(result.reply());
        if (hasReply) {
            lead.recordOutbound(now);
        }
        followupPolicyDomainService.restartSilenceWindow(lead, now, followupInterval);
        leadScoringDomainService.rescore(lead);
        lead.setUpdatedAt(now);
        if (!leadRepository.updateWithVersion(lead)) {
            return false;
        }
        leadInteractionRepository.append(LeadInteractionEntity.inbound(lead, channel, inboundText, now));
        if (hasReply) {
            leadInteractionRepository.append(LeadInteractionEntity.outbound(lead, channel, result.reply(), true, now));
        }
        return true;
    }

    /**
     * 跟进投递成功后推进线索；认领已失效时不做任何修改
     *
     * @return 是否已提交
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean completeFollowupDelivered(Long leadId,
                                             String claimOwner,
                                             int claimAttempt,
                                             ChannelEnum channel,
                                             String text,
                                             LocalDateTime now) {
        LeadEntity lead = lockClaimed(leadId, claimOwner, claimAttempt);
        if (lead == null) {
            return false;
        }
        leadInteractionRepository.append(LeadInteractionEntity.outbound(lead, channel, text, true, now));
        followupPolicyDomainService.applyDelivered(lead, now, followupInterval);
        leadScoringDomainService.rescore(lead);
        lead.releaseClaim();
        leadRepository.update(lead);
        if (lead.getNextFollowupAt() == null) {
            log.info("Lead left follow-up pipeline. leadId={}, followupCount={}", leadId, lead.getFollowupCount());
        }
        return true;
    }

    /**
     * 跟进投递失败：保留次数与下次时间，记录失败轮次
     */
    @Transactional(rollbackFor = Exception.class)
    public FailedCycleOutcome completeFollowupFailed(Long leadId,
                                                     String claimOwner,
                                                     int claimAttempt,
                                                     ChannelEnum channel,
                                                     String text,
                                                     LocalDateTime now) {
        LeadEntity lead = lockClaimed(leadId, claimOwner, claimAttempt);
        if (lead == null) {
            return FailedCycleOutcome.STALE_CLAIM;
        }
        leadInteractionRepository.append(LeadInteractionEntity.outbound(lead, channel, text, false, now));
        boolean undeliverable = followupPolicyDomainService.applyFailed(lead, now, maxFailedCycles);
        leadScoringDomainService.rescore(lead);
        lead.releaseClaim();
        leadRepository.update(lead);
        if (undeliverable) {
            log.warn("Lead marked undeliverable after consecutive failed cycles. leadId={}, failedCycles={}",
                    leadId, lead.getFailedFollowupCycles());
            return FailedCycleOutcome.UNDELIVERABLE;
        }
        return FailedCycleOutcome.DEFERRED;
    }

    /**
     * 没有可触达渠道的线索移出流程
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean dropUnreachable(Long leadId, String claimOwner, int claimAttempt, LocalDateTime now) {
        LeadEntity lead = lockClaimed(leadId, claimOwner, claimAttempt);
        if (lead == null) {
            return false;
        }
        lead.removeFromPipeline();
        lead.releaseClaim();
        lead.setUpdatedAt(now);
        leadScoringDomainService.rescore(lead);
        leadRepository.update(lead);
        log.info("Lead dropped from follow-up pipeline, no reachable channel. leadId={}", leadId);
        return true;
    }

    /**
     * 人工移出自动跟进流程；进行中的认领在完成时会读到已清空的下次时间
     */
    @Transactional(rollbackFor = Exception.class)
    public LeadEntity removeFromPipeline(Long leadId, LocalDateTime now) {
        LeadEntity lead = lockExisting(leadId);
        followupPolicyDomainService.removeManually(lead, now);
        leadScoringDomainService.rescore(lead);
        leadRepository.update(lead);
        log.info("Lead removed from follow-up pipeline. leadId={}", leadId);
        return lead;
    }

    /**
     * 活动消息投递成功：记录交互与发送计数，不推进跟进次数
     */
    @Transactional(rollbackFor = Exception.class)
    public void recordCampaignDelivered(Long leadId, Long campaignId, ChannelEnum channel, String text, LocalDateTime now) {
        LeadEntity lead = lockExisting(leadId);
        LeadInteractionEntity interaction = LeadInteractionEntity.outbound(lead, channel, text, true, now);
        interaction.setCampaignId(campaignId);
        leadInteractionRepository.append(interaction);
        lead.recordOutbound(now);
        lead.setUpdatedAt(now);
        leadScoringDomainService.rescore(lead);
        leadRepository.update(lead);
    }

    /**
     * 记录一次失败的出站投递，线索字段不变
     */
    @Transactional(rollbackFor = Exception.class)
    public void recordFailedDelivery(LeadEntity lead, Long campaignId, ChannelEnum channel, String text, LocalDateTime now) {
        LeadInteractionEntity interaction = LeadInteractionEntity.outbound(lead, channel, text, false, now);
        interaction.setCampaignId(campaignId);
        leadInteractionRepository.append(interaction);
    }

    /**
     * 匹配通知投递成功：标记已通知、记录交互并加入已匹配房源
     */
    @Transactional(rollbackFor = Exception.class)
    public void recordMatchNotified(Long leadId, Long propertyId, ChannelEnum channel, String text, LocalDateTime now) {
        LeadEntity lead = lockExisting(leadId);
        propertyMatchRepository.markNotified(propertyId, leadId, now);
        leadInteractionRepository.append(LeadInteractionEntity.outbound(lead, channel, text, true, now));
        Set<Long> matched = lead.getMatchedPropertyIds() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(lead.getMatchedPropertyIds());
        matched.add(propertyId);
        lead.setMatchedPropertyIds(matched);
        lead.recordOutbound(now);
        lead.setUpdatedAt(now);
        leadScoringDomainService.rescore(lead);
        leadRepository.update(lead);
    }

    /**
     * 外部记录的交互：更新计数后重算评分，入站消息重新开始沉默计时
     */
    @Transactional(rollbackFor = Exception.class)
    public LeadEntity recordInteraction(Long leadId,
                                        ChannelEnum channel,
                                        InteractionDirectionEnum direction,
                                        String text,
                                        LocalDateTime now) {
        if (channel == null || direction == null) {
            throw AppException.illegalParameter("channel 与 direction 不能为空");
        }
        LeadEntity lead = lockExisting(leadId);
        if (direction == InteractionDirectionEnum.INBOUND) {
            lead.recordInbound(now);
            followupPolicyDomainService.restartSilenceWindow(lead, now, followupInterval);
            leadInteractionRepository.append(LeadInteractionEntity.inbound(lead, channel, text, now));
        } else {
            lead.recordOutbound(now);
            LeadInteractionEntity interaction = LeadInteractionEntity.outbound(lead, channel, text, true, now);
            interaction.setAutomated(false);
            leadInteractionRepository.append(interaction);
        }
        lead.setUpdatedAt(now);
        leadScoringDomainService.rescore(lead);
        leadRepository.update(lead);
        return lead;
    }

    @Transactional(rollbackFor = Exception.class)
    public LeadEntity markViewed(Long leadId, Long propertyId) {
        LeadEntity lead = lockExisting(leadId);
        Set<Long> viewed = lead.getViewedPropertyIds() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(lead.getViewedPropertyIds());
        if (viewed.add(propertyId)) {
            lead.setViewedPropertyIds(viewed);
            lead.setUpdatedAt(LocalDateTime.now());
            leadScoringDomainService.rescore(lead);
            leadRepository.update(lead);
        }
        return lead;
    }

    @Transactional(rollbackFor = Exception.class)
    public LeadEntity markFavorited(Long leadId, Long propertyId) {
        LeadEntity lead = lockExisting(leadId);
        Set<Long> favorited = lead.getFavoritedPropertyIds() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(lead.getFavoritedPropertyIds());
        if (favorited.add(propertyId)) {
            lead.setFavoritedPropertyIds(favorited);
            lead.setUpdatedAt(LocalDateTime.now());
            leadScoringDomainService.rescore(lead);
            leadRepository.update(lead);
        }
        return lead;
    }

    public Duration getFollowupInterval() {
        return followupInterval;
    }

    /**
     * 会话中给出的手机号已归属同租户其它线索时不写入，槽位照常填充
     */
    private void skipForeignPhone(LeadEntity lead, AdvanceResult result) {
        String phone = result.fieldUpdates().getPhone();
        if (phone == null || StringUtils.isNotBlank(lead.getPhone())) {
            return;
        }
        LeadEntity owner = leadRepository.findByPhone(lead.getTenantId(), phone);
        if (owner != null && !owner.getId().equals(lead.getId())) {
            log.info("Skip conversation phone owned by another lead. leadId={}, ownerLeadId={}", lead.getId(), owner.getId());
            result.fieldUpdates().phone(null);
        }
    }

    private LeadEntity lockExisting(Long leadId) {
        if (leadId == null) {
            throw AppException.illegalParameter("leadId 不能为空");
        }
        LeadEntity lead = leadRepository.findByIdForUpdate(leadId);
        if (lead == null) {
            throw AppException.notFound("Lead not found: " + leadId);
        }
        return lead;
    }

    private LeadEntity lockClaimed(Long leadId, String claimOwner, int claimAttempt) {
        LeadEntity lead = leadRepository.findByIdForUpdate(leadId);
        if (lead == null) {
            log.warn("Claimed lead disappeared. leadId={}", leadId);
            return null;
        }
        if (!lead.isClaimedBy(claimOwner, claimAttempt)) {
            log.debug("Skip stale follow-up claim. leadId={}, claimOwner={}, claimAttempt={}, currentOwner={}, currentAttempt={}",
                    leadId, claimOwner, claimAttempt, lead.getClaimOwner(), lead.getClaimAttempt());
            return null;
        }
        return lead;
    }

    public enum FailedCycleOutcome {
        DEFERRED,
        UNDELIVERABLE,
        STALE_CLAIM
    }
}
