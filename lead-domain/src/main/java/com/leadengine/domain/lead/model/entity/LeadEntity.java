package com.leadengine.domain.lead.model.entity;

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
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 线索领域实体，租户内唯一的潜在客户。
 * <p>
 * 身份键、资质字段、会话状态、互动统计、跟进调度与评分都落在同一条记录上，
 * 评分与等级只能由 {@code LeadScoringDomainService} 根据其它字段重新计算。
 * </p>
 */
@Data
public class LeadEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 租户 ID
     */
    private Long tenantId;

    private String name;
    private String email;
    private String jobTitle;
    private String company;

    /**
     * 身份键：外部主页 URL（如 LinkedIn）
     */
    private String profileUrl;

    /**
     * 身份键：Telegram 用户 ID
     */
    private String telegramUserId;

    /**
     * 身份键：WhatsApp 用户 ID
     */
    private String whatsappUserId;

    /**
     * 身份键：手机号
     */
    private String phone;

    private LeadSourceEnum source;
    private LeadStatusEnum status;

    // 资质
    private TransactionTypeEnum transactionType;
    private PropertyTypeEnum propertyType;
    private BigDecimal budgetMin;
    private BigDecimal budgetMax;
    private Integer bedroomsMin;
    private Integer bedroomsMax;
    private Set<String> preferredLocations = new LinkedHashSet<>();
    private PurposeEnum purpose;
    private PaymentMethodEnum paymentMethod;

    // 会话
    private ConversationStateEnum conversationState;
    private ConversationSlotEnum pendingSlot;
    private Map<String, Boolean> filledSlots = new HashMap<>();
    private LanguageEnum language;
    private Map<String, Object> conversationData = new HashMap<>();

    // 互动
    private int messagesSent;
    private int messagesReceived;
    private LocalDateTime lastActiveAt;
    private LocalDateTime lastContactedAt;

    // 跟进
    /**
     * 下次跟进时间，为 null 表示不在自动跟进流程中
     */
    private LocalDateTime nextFollowupAt;
    private int followupCount;

    /**
     * 连续投递失败的跟进轮次
     */
    private int failedFollowupCycles;

    // 评分（派生字段）
    private int score;
    private LeadGradeEnum grade;

    // 匹配
    private Set<Long> matchedPropertyIds = new LinkedHashSet<>();
    private Set<Long> viewedPropertyIds = new LinkedHashSet<>();
    private Set<Long> favoritedPropertyIds = new LinkedHashSet<>();

    // 认领
    private String claimOwner;
    private LocalDateTime claimExpiresAt;
    private int claimAttempt;

    /**
     * 乐观锁版本号
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * 校验必填字段
     */
    public void validate() {
        if (tenantId == null) {
            throw new IllegalStateException("Tenant ID cannot be null");
        }
        if (!hasIdentityKey()) {
            throw new IllegalStateException("Lead requires at least one identity key");
        }
        if (followupCount < 0 || followupCount > FollowupStageEnum.MAX_FOLLOWUPS) {
            throw new IllegalStateException("Follow-up count out of range: " + followupCount);
        }
    }

    public boolean hasIdentityKey() {
        return hasText(profileUrl) || hasText(telegramUserId) || hasText(whatsappUserId) || hasText(phone);
    }

    /**
     * 是否存在可直接触达的消息渠道身份
     */
    public boolean hasReachableChannel() {
        return reachableChannel() != null;
    }

    /**
     * 首选触达渠道：Telegram 优先，其次 WhatsApp
     */
    public ChannelEnum reachableChannel() {
        if (hasText(telegramUserId)) {
            return ChannelEnum.TELEGRAM;
        }
        if (hasText(whatsappUserId)) {
            return ChannelEnum.WHATSAPP;
        }
        return null;
    }

    public String channelUserId(ChannelEnum channel) {
        if (channel == null) {
            return null;
        }
        switch (channel) {
            case TELEGRAM:
                return telegramUserId;
            case WHATSAPP:
                return whatsappUserId;
            case LINKEDIN:
                return profileUrl;
            case EMAIL:
                return email;
            case PHONE:
                return phone;
            default:
                return null;
        }
    }

    public boolean isSlotFilled(ConversationSlotEnum slot) {
        if (slot == null || filledSlots == null) {
            return false;
        }
        return Boolean.TRUE.equals(filledSlots.get(slot.getCode()));
    }

    public void markSlotFilled(ConversationSlotEnum slot) {
        if (slot == null) {
            return;
        }
        if (filledSlots == null) {
            filledSlots = new HashMap<>();
        }
        filledSlots.put(slot.getCode(), Boolean.TRUE);
    }

    /**
     * 记录一条入站消息
     */
    public void recordInbound(LocalDateTime at) {
        this.messagesReceived++;
        this.lastActiveAt = at;
    }

    /**
     * 记录一条已投递的出站消息
     */
    public void recordOutbound(LocalDateTime at) {
        this.messagesSent++;
        this.lastContactedAt = at;
    }

    public boolean isInFollowupPipeline() {
        return nextFollowupAt != null;
    }

    public boolean isFollowupCapReached() {
        return followupCount >= FollowupStageEnum.MAX_FOLLOWUPS;
    }

    /**
     * 移出自动跟进流程
     */
    public void removeFromPipeline() {
        this.nextFollowupAt = null;
    }

    public boolean isClaimedBy(String owner, int attempt) {
        return owner != null && owner.equals(claimOwner) && claimAttempt == attempt;
    }

    public void releaseClaim() {
        this.claimOwner = null;
        this.claimExpiresAt = null;
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
