package com.leadengine.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 线索 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadPO {

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
    private String profileUrl;
    private String telegramUserId;
    private String whatsappUserId;
    private String phone;

    /**
     * 来源编码
     */
    private String source;

    /**
     * 状态编码 (open/won/lost/nurturing)
     */
    private String status;

    private String transactionType;
    private String propertyType;
    private BigDecimal budgetMin;
    private BigDecimal budgetMax;
    private Integer bedroomsMin;
    private Integer bedroomsMax;

    /**
     * 偏好地点 (JSONB 数组)
     */
    private String preferredLocations;

    private String purpose;
    private String paymentMethod;

    private String conversationState;
    private String pendingSlot;

    /**
     * 已填槽位 (JSONB)
     */
    private String filledSlots;

    private String language;

    /**
     * 会话临时数据 (JSONB)
     */
    private String conversationData;

    private Integer messagesSent;
    private Integer messagesReceived;
    private LocalDateTime lastActiveAt;
    private LocalDateTime lastContactedAt;

    private LocalDateTime nextFollowupAt;
    private Integer followupCount;
    private Integer failedFollowupCycles;

    private Integer score;
    private String grade;

    /**
     * 已匹配/已查看/已收藏房源 ID (JSONB 数组)
     */
    private String matchedPropertyIds;
    private String viewedPropertyIds;
    private String favoritedPropertyIds;

    /**
     * 认领者标识
     */
    private String claimOwner;

    /**
     * 认领租约过期时间
     */
    private LocalDateTime claimExpiresAt;

    /**
     * 认领次数
     */
    private Integer claimAttempt;

    /**
     * 乐观锁版本号
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
