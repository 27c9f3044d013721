package com.leadengine.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * 线索视图
 */
@Data
public class LeadDTO {

    private Long id;
    private Long tenantId;
    private String name;
    private String email;
    private String jobTitle;
    private String company;
    private String profileUrl;
    private String telegramUserId;
    private String whatsappUserId;
    private String phone;
    private String source;
    private String status;

    private String transactionType;
    private String propertyType;
    private BigDecimal budgetMin;
    private BigDecimal budgetMax;
    private Set<String> preferredLocations;
    private String purpose;

    private String conversationState;
    private String language;

    private Integer messagesSent;
    private Integer messagesReceived;
    private LocalDateTime lastActiveAt;
    private LocalDateTime lastContactedAt;

    private LocalDateTime nextFollowupAt;
    private Integer followupCount;

    private Integer score;
    private String grade;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
