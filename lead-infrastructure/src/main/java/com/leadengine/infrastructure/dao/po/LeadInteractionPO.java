package com.leadengine.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 线索交互记录 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadInteractionPO {

    private Long id;

    private Long leadId;

    private Long tenantId;

    private String channel;

    /**
     * inbound / outbound
     */
    private String direction;

    private String text;

    private Boolean automated;

    /**
     * received / delivered / failed
     */
    private String deliveryStatus;

    private Long campaignId;

    private LocalDateTime createdAt;
}
