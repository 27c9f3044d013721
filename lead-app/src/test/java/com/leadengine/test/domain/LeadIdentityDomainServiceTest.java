package com.leadengine.test.domain;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.domain.lead.service.LeadIdentityDomainService;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

public class LeadIdentityDomainServiceTest {

    private final LeadIdentityDomainService identity = new LeadIdentityDomainService();

    @Test
    public void shouldNormalizePhoneNumbers() {
        Assertions.assertEquals("+971501234567", identity.normalizePhone(" +971 (50) 123-4567 "));
        Assertions.assertEquals("+971501234567", identity.normalizePhone("00971501234567"));
        Assertions.assertEquals("0501234567", identity.normalizePhone("050 123 4567"));
        Assertions.assertEquals("+989121234567", identity.normalizePhone("+۹۸۹۱۲۱۲۳۴۵۶۷"));
        Assertions.assertNull(identity.normalizePhone("12345"));
        Assertions.assertNull(identity.normalizePhone("   "));
    }

    @Test
    public void shouldNormalizeIdentityKeys() {
        ObservedLeadFields normalized = identity.normalize(1L, ObservedLeadFields.builder()
                .profileUrl(" https://www.LinkedIn.com/in/Maryam/ ")
                .email(" Maryam@Example.COM ")
                .name("  Maryam ")
                .build());

        Assertions.assertEquals("https://www.linkedin.com/in/maryam", normalized.getProfileUrl());
        Assertions.assertEquals("maryam@example.com", normalized.getEmail());
        Assertions.assertEquals("Maryam", normalized.getName());
    }

    @Test
    public void shouldRejectMissingKeysOrForeignChannelUserId() {
        Assertions.assertThrows(AppException.class,
                () -> identity.normalize(null, ObservedLeadFields.builder().phone("+971501234567").build()));
        Assertions.assertThrows(AppException.class,
                () -> identity.normalize(1L, ObservedLeadFields.builder().name("No key").build()));
        Assertions.assertThrows(AppException.class,
                () -> identity.normalize(1L, ObservedLeadFields.builder()
                        .channel(ChannelEnum.LINKEDIN).channelUserId("li-1").build()));
    }

    @Test
    public void shouldCreateOpenLeadWithSourceFromChannel() {
        LocalDateTime now = LocalDateTime.now();

        LeadEntity lead = identity.newLead(4L, ObservedLeadFields.builder()
                .channel(ChannelEnum.WHATSAPP)
                .channelUserId("wa-4")
                .build(), now);

        Assertions.assertEquals(LeadStatusEnum.OPEN, lead.getStatus());
        Assertions.assertEquals(ConversationStateEnum.START, lead.getConversationState());
        Assertions.assertEquals(LeadSourceEnum.WHATSAPP, lead.getSource());
        Assertions.assertEquals("wa-4", lead.getWhatsappUserId());
        Assertions.assertEquals(now, lead.getCreatedAt());
    }

    @Test
    public void shouldMergeOnlyIntoEmptyFields() {
        LeadEntity lead = new LeadEntity();
        lead.setName("Original");
        lead.setTelegramUserId("tg-1");

        boolean changed = identity.mergeInto(lead, ObservedLeadFields.builder()
                .channel(ChannelEnum.TELEGRAM)
                .channelUserId("tg-other")
                .name("Replacement")
                .phone("+971501111111")
                .build());

        Assertions.assertTrue(changed);
        Assertions.assertEquals("Original", lead.getName());
        Assertions.assertEquals("tg-1", lead.getTelegramUserId());
        Assertions.assertEquals("+971501111111", lead.getPhone());
        Assertions.assertFalse(identity.mergeInto(lead, ObservedLeadFields.builder().name("Again").build()));
    }
}
