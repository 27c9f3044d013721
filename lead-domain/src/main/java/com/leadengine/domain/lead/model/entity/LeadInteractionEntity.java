package com.leadengine.domain.lead.model.entity;

import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.DeliveryStatusEnum;
import com.leadengine.types.enums.InteractionDirectionEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 线索交互记录，只追加不修改。
 */
@Data
public class LeadInteractionEntity {

    private Long id;

    private Long leadId;

    private Long tenantId;

    private ChannelEnum channel;

    private InteractionDirectionEnum direction;

    private String text;

    /**
     * 是否由系统自动发出
     */
    private boolean automated;

    private DeliveryStatusEnum deliveryStatus;

    /**
     * 所属跟进活动，可空
     */
    private Long campaignId;

    private LocalDateTime createdAt;

    public static LeadInteractionEntity inbound(LeadEntity lead, ChannelEnum channel, String text, LocalDateTime at) {
        LeadInteractionEntity entity = base(lead, channel, text, at);
        entity.setDirection(InteractionDirectionEnum.INBOUND);
        entity.setDeliveryStatus(DeliveryStatusEnum.RECEIVED);
        entity.setAutomated(false);
        return entity;
    }

    public static LeadInteractionEntity outbound(LeadEntity lead, ChannelEnum channel, String text,
                                                 boolean delivered, LocalDateTime at) {
        LeadInteractionEntity entity = base(lead, channel, text, at);
        entity.setDirection(InteractionDirectionEnum.OUTBOUND);
        entity.setDeliveryStatus(delivered ? DeliveryStatusEnum.DELIVERED : DeliveryStatusEnum.FAILED);
        entity.setAutomated(true);
        return entity;
    }

    public void validate() {
        if (leadId == null) {
            throw new IllegalStateException("Lead ID cannot be null");
        }
        if (channel == null || direction == null) {
            throw new IllegalStateException("Interaction channel and direction are required");
        }
    }

    private static LeadInteractionEntity base(LeadEntity lead, ChannelEnum channel, String text, LocalDateTime at) {
        LeadInteractionEntity entity = new LeadInteractionEntity();
        entity.setLeadId(lead.getId());
        entity.setTenantId(lead.getTenantId());
        entity.setChannel(channel);
        entity.setText(text);
        entity.setCreatedAt(at);
        return entity;
    }
}
