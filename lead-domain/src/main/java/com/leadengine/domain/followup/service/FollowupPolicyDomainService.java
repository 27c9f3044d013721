package com.leadengine.domain.followup.service;

import com.leadengine.domain.conversation.service.ConversationMessageCatalog;
import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.FollowupStageEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 跟进策略领域服务：阶段推导、模板渲染与投递结果对线索字段的影响。
 */
@Service
public class FollowupPolicyDomainService {

    public static final String DATA_PIPELINE_REMOVED = "pipelineRemoved";

    private final ConversationMessageCatalog messageCatalog;

    public FollowupPolicyDomainService(ConversationMessageCatalog messageCatalog) {
        this.messageCatalog = messageCatalog;
    }

    public FollowupStageEnum stageOf(LeadEntity lead) {
        return lead == null ? null : FollowupStageEnum.fromCount(lead.getFollowupCount());
    }

    public String renderStageMessage(LeadEntity lead, FollowupStageEnum stage) {
        return messageCatalog.text("followup.stage." + stage.getIndex(), lead.getLanguage(), firstName(lead));
    }

    /**
     * 新房源匹配通知文本
     */
    public String renderPropertyMatchMessage(LeadEntity lead, PropertyEntity property) {
        return messageCatalog.text("followup.property_match", lead.getLanguage(), firstName(lead),
                property.getName(),
                StringUtils.defaultIfBlank(property.getLocation(), "-"),
                property.getPrice() == null ? "-" : property.getPrice().toPlainString());
    }

    public String renderCampaignMessage(FollowupCampaignEntity campaign, LeadEntity lead) {
        return StringUtils.replace(campaign.getMessageTemplate(), "{name}", firstName(lead));
    }

    /**
     * 在活动允许的渠道中选出线索可触达的渠道，Telegram 优先
     */
    public ChannelEnum selectChannel(FollowupCampaignEntity campaign, LeadEntity lead) {
        if (campaign == null || campaign.getChannels() == null || campaign.getChannels().isEmpty()) {
            return lead.reachableChannel();
        }
        for (ChannelEnum channel : new ChannelEnum[]{ChannelEnum.TELEGRAM, ChannelEnum.WHATSAPP}) {
            if (campaign.getChannels().contains(channel) && StringUtils.isNotBlank(lead.channelUserId(channel))) {
                return channel;
            }
        }
        return null;
    }

    public boolean isEligible(LeadEntity lead, LocalDateTime now) {
        return lead != null
                && lead.getStatus() == LeadStatusEnum.OPEN
                && !lead.isFollowupCapReached()
                && lead.getNextFollowupAt() != null
                && !lead.getNextFollowupAt().isAfter(now);
    }

    /**
     * 最近一次触达距今不足最小间隔
     */
    public boolean isWithinContactGap(LeadEntity lead, LocalDateTime now, Duration minGap) {
        if (lead == null || lead.getLastContactedAt() == null || minGap == null || minGap.isZero()) {
            return false;
        }
        return lead.getLastContactedAt().plus(minGap).isAfter(now);
    }

    /**
     * 投递成功：次数 +1，按间隔重新排期；已被并发移出流程或达到上限时下次时间为 null。
     * <p>
     * lead 必须是加锁后重新读取的最新记录，以便感知并发清空。
     * </p>
     */
    public void applyDelivered(LeadEntity lead, LocalDateTime now, Duration interval) {
        boolean stillScheduled = lead.getNextFollowupAt() != null;
        lead.setFollowupCount(Math.min(lead.getFollowupCount() + 1, FollowupStageEnum.MAX_FOLLOWUPS));
        lead.recordOutbound(now);
        lead.setFailedFollowupCycles(0);
        if (!stillScheduled || lead.isFollowupCapReached()) {
            lead.setNextFollowupAt(null);
        } else {
            lead.setNextFollowupAt(now.plus(interval));
        }
        lead.setUpdatedAt(now);
    }

    /**
     * 投递失败：次数与下次时间不变，连续失败轮次 +1，达到上限时标记为不可投递
     *
     * @return 是否被标记为不可投递
     */
    public boolean applyFailed(LeadEntity lead, LocalDateTime now, int maxFailedCycles) {
        lead.setFailedFollowupCycles(lead.getFailedFollowupCycles() + 1);
        lead.setUpdatedAt(now);
        if (maxFailedCycles > 0 && lead.getFailedFollowupCycles() >= maxFailedCycles) {
            lead.removeFromPipeline();
            lead.setStatus(LeadStatusEnum.NURTURING);
            return true;
        }
        return false;
    }

    /**
     * 线索有新的入站消息时重新开始沉默计时。人工移出流程的线索不会被重新加入。
     */
    public void restartSilenceWindow(LeadEntity lead, LocalDateTime now, Duration interval) {
        if (isRemovedManually(lead)) {
            return;
        }
        if (lead.getStatus() != LeadStatusEnum.OPEN || lead.isFollowupCapReached()
                || (lead.getConversationState() != null && lead.getConversationState().isTerminal())) {
            lead.removeFromPipeline();
            return;
        }
        lead.setNextFollowupAt(now.plus(interval));
    }

    /**
     * 人工移出自动跟进流程
     */
    public void removeManually(LeadEntity lead, LocalDateTime now) {
        lead.removeFromPipeline();
        Map<String, Object> data = lead.getConversationData() == null
                ? new HashMap<>()
                : new HashMap<>(lead.getConversationData());
        data.put(DATA_PIPELINE_REMOVED, Boolean.TRUE);
        lead.setConversationData(data);
        lead.setUpdatedAt(now);
    }

    private boolean isRemovedManually(LeadEntity lead) {
        return lead.getConversationData() != null
                && Boolean.TRUE.equals(lead.getConversationData().get(DATA_PIPELINE_REMOVED));
    }

    private String firstName(LeadEntity lead) {
        String name = StringUtils.trimToNull(lead.getName());
        if (name == null) {
            return messageCatalog.text("followup.default_name", lead.getLanguage());
        }
        return StringUtils.split(name, ' ')[0];
    }
}
