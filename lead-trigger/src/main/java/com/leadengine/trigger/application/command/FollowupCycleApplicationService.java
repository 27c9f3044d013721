package com.leadengine.trigger.application.command;

import com.leadengine.domain.followup.adapter.gateway.IChannelSender;
import com.leadengine.domain.followup.model.valobj.CycleResult;
import com.leadengine.domain.followup.model.valobj.OutboundMessage;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.trigger.application.common.BoundedRetry;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.FollowupStageEnum;
import com.leadengine.types.exception.ChannelDeliveryException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 自动跟进一轮：认领到期线索 -> 渲染阶段消息 -> 有界重试投递 -> 按结果推进并释放认领。
 * <p>
 * 无状态，可由多个实例并发调用；互斥由认领查询的 SKIP LOCKED 与认领校验保证。
 * </p>
 */
@Slf4j
@Service
public class FollowupCycleApplicationService {

    private final ILeadRepository leadRepository;
    private final IChannelSender channelSender;
    private final FollowupPolicyDomainService followupPolicyDomainService;
    private final LeadPersistenceApplicationService leadPersistenceApplicationService;
    private final BoundedRetry boundedRetry;
    private final String claimOwner;
    private final int leaseSeconds;
    private final int defaultBatchSize;
    private final Duration minContactGap;
    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;
    private final Counter undeliverableCounter;

    public FollowupCycleApplicationService(ILeadRepository leadRepository,
                                           IChannelSender channelSender,
                                           FollowupPolicyDomainService followupPolicyDomainService,
                                           LeadPersistenceApplicationService leadPersistenceApplicationService,
                                           BoundedRetry boundedRetry,
                                           @Value("${followup.claim-owner:}") String configuredClaimOwner,
                                           @Value("${followup.claim-lease-seconds:300}") int leaseSeconds,
                                           @Value("${followup.batch-size:50}") int defaultBatchSize,
                                           @Value("${followup.min-contact-gap-minutes:120}") long minContactGapMinutes) {
        this.leadRepository = leadRepository;
        this.channelSender = channelSender;
        this.followupPolicyDomainService = followupPolicyDomainService;
        this.leadPersistenceApplicationService = leadPersistenceApplicationService;
        this.boundedRetry = boundedRetry;
        this.claimOwner = resolveClaimOwner(configuredClaimOwner);
        this.leaseSeconds = leaseSeconds > 0 ? leaseSeconds : 300;
        this.defaultBatchSize = defaultBatchSize > 0 ? defaultBatchSize : 50;
        this.minContactGap = Duration.ofMinutes(Math.max(minContactGapMinutes, 0L));
        this.deliveredCounter = Counter.builder("lead.followup.delivered.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("lead.followup.failed.total").register(Metrics.globalRegistry);
        this.skippedCounter = Counter.builder("lead.followup.skipped.total").register(Metrics.globalRegistry);
        this.undeliverableCounter = Counter.builder("lead.followup.undeliverable.total").register(Metrics.globalRegistry);
    }

    public CycleResult runCycle() {
        return runCycle(defaultBatchSize);
    }

    public CycleResult runCycle(int batchSize) {
        int limit = batchSize > 0 ? batchSize : defaultBatchSize;
        List<LeadEntity> claimed = leadRepository.claimDueFollowups(claimOwner, limit, leaseSeconds);
        if (claimed == null || claimed.isEmpty()) {
            return CycleResult.empty();
        }

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        for (LeadEntity lead : claimed) {
            LeadOutcome outcome;
            try {
                outcome = processLead(lead);
            } catch (RuntimeException ex) {
                log.error("Follow-up processing failed, claim left to expire. leadId={}, error={}",
                        lead.getId(), ex.getMessage(), ex);
                outcome = LeadOutcome.FAILED;
            }
            if (outcome == LeadOutcome.SKIPPED) {
                continue;
            }
            attempted++;
            if (outcome == LeadOutcome.DELIVERED) {
                succeeded++;
            } else {
                failed++;
            }
        }
        if (attempted > 0) {
            log.info("Follow-up cycle finished. claimOwner={}, claimed={}, attempted={}, succeeded={}, failed={}",
                    claimOwner, claimed.size(), attempted, succeeded, failed);
        }
        return new CycleResult(attempted, succeeded, failed);
    }

    private LeadOutcome processLead(LeadEntity lead) {
        LocalDateTime now = LocalDateTime.now();
        ChannelEnum channel = lead.reachableChannel();
        if (channel == null) {
            leadPersistenceApplicationService.dropUnreachable(lead.getId(), claimOwner, lead.getClaimAttempt(), now);
            skippedCounter.increment();
            return LeadOutcome.SKIPPED;
        }
        FollowupStageEnum stage = followupPolicyDomainService.stageOf(lead);
        if (stage == null || followupPolicyDomainService.isWithinContactGap(lead, now, minContactGap)) {
            log.debug("Follow-up skipped for lead. leadId={}, followupCount={}, lastContactedAt={}",
                    lead.getId(), lead.getFollowupCount(), lead.getLastContactedAt());
            leadRepository.releaseClaim(lead.getId(), claimOwner, lead.getClaimAttempt());
            skippedCounter.increment();
            return LeadOutcome.SKIPPED;
        }

        String text = followupPolicyDomainService.renderStageMessage(lead, stage);
        OutboundMessage message = new OutboundMessage(lead.getId(), channel, lead.channelUserId(channel), text);
        try {
            boundedRetry.run("followup:" + lead.getId(), () -> channelSender.send(message));
        } catch (ChannelDeliveryException ex) {
            failedCounter.increment();
            LeadPersistenceApplicationService.FailedCycleOutcome outcome = leadPersistenceApplicationService
                    .completeFollowupFailed(lead.getId(), claimOwner, lead.getClaimAttempt(), channel, text, LocalDateTime.now());
            if (outcome == LeadPersistenceApplicationService.FailedCycleOutcome.UNDELIVERABLE) {
                undeliverableCounter.increment();
            }
            log.info("Follow-up deferred to next cycle. leadId={}, stage={}, outcome={}, error={}",
                    lead.getId(), stage.name(), outcome, ex.getMessage());
            return LeadOutcome.FAILED;
        }

        boolean committed = leadPersistenceApplicationService.completeFollowupDelivered(
                lead.getId(), claimOwner, lead.getClaimAttempt(), channel, text, LocalDateTime.now());
        deliveredCounter.increment();
        log.info("Follow-up delivered. leadId={}, stage={}, channel={}, committed={}",
                lead.getId(), stage.name(), channel.getCode(), committed);
        return LeadOutcome.DELIVERED;
    }

    public String getClaimOwner() {
        return claimOwner;
    }

    private enum LeadOutcome {
        DELIVERED,
        FAILED,
        SKIPPED
    }

    private String resolveClaimOwner(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String pid = ManagementFactory.getRuntimeMXBean().getName();
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + pid;
        } catch (UnknownHostException ex) {
            log.debug("Local host name unavailable, using runtime name as claim owner. error={}", ex.getMessage());
            return "instance-" + pid;
        }
    }
}
