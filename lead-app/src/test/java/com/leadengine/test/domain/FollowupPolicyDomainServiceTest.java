package com.leadengine.test.domain;

import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.followup.service.FollowupPolicyDomainService;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.test.support.LeadEngineFixture;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.FollowupStageEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public class FollowupPolicyDomainServiceTest {

    private static final Duration INTERVAL = Duration.ofDays(3);

    private final LeadEngineFixture fixture = new LeadEngineFixture();
    private final FollowupPolicyDomainService policy = fixture.followupPolicyDomainService;

    @Test
    public void shouldDeriveStageFromFollowupCount() {
        LeadEntity lead = fixture.dueTelegramLead("tg-1", "Reza");

        Assertions.assertEquals(FollowupStageEnum.INTRODUCTION, policy.stageOf(lead));
        lead.setFollowupCount(2);
        Assertions.assertEquals(FollowupStageEnum.URGENCY, policy.stageOf(lead));
        lead.setFollowupCount(4);
        Assertions.assertEquals(FollowupStageEnum.GRACEFUL_EXIT, policy.stageOf(lead));
        lead.setFollowupCount(5);
        Assertions.assertNull(policy.stageOf(lead));
    }

    @Test
    public void shouldRenderStageWithFirstNameOrDefault() {
        LeadEntity named = fixture.dueTelegramLead("tg-2", "Reza Karimi");
        LeadEntity anonymous = fixture.dueTelegramLead("tg-3", "  ");

        Assertions.assertTrue(policy.renderStageMessage(named, FollowupStageEnum.URGENCY)
                .startsWith("Hi Reza, several projects we shortlisted"));
        Assertions.assertTrue(policy.renderStageMessage(anonymous, FollowupStageEnum.GRACEFUL_EXIT)
                .startsWith("Hi there, we will not bother you further"));
    }

    @Test
    public void shouldRescheduleAfterDeliveryUntilCap() {
        LocalDateTime now = LocalDateTime.now();
        LeadEntity lead = fixture.dueTelegramLead("tg-4", "Sara");
        lead.setFollowupCount(3);
        lead.setFailedFollowupCycles(2);

        policy.applyDelivered(lead, now, INTERVAL);
        Assertions.assertEquals(4, lead.getFollowupCount());
        Assertions.assertEquals(now.plus(INTERVAL), lead.getNextFollowupAt());
        Assertions.assertEquals(0, lead.getFailedFollowupCycles());
        Assertions.assertEquals(now, lead.getLastContactedAt());

        policy.applyDelivered(lead, now, INTERVAL);
        Assertions.assertEquals(5, lead.getFollowupCount());
        Assertions.assertNull(lead.getNextFollowupAt());
    }

    @Test
    public void shouldNotRescheduleWhenRemovedConcurrently() {
        LeadEntity lead = fixture.dueTelegramLead("tg-5", "Ali");
        lead.setNextFollowupAt(null);

        policy.applyDelivered(lead, LocalDateTime.now(), INTERVAL);

        Assertions.assertEquals(1, lead.getFollowupCount());
        Assertions.assertNull(lead.getNextFollowupAt());
    }

    @Test
    public void shouldMarkUndeliverableAfterMaxFailedCycles() {
        LocalDateTime now = LocalDateTime.now();
        LeadEntity lead = fixture.dueTelegramLead("tg-6", "Mina");
        LocalDateTime scheduled = lead.getNextFollowupAt();

        Assertions.assertFalse(policy.applyFailed(lead, now, 2));
        Assertions.assertEquals(scheduled, lead.getNextFollowupAt());
        Assertions.assertTrue(policy.applyFailed(lead, now, 2));
        Assertions.assertNull(lead.getNextFollowupAt());
        Assertions.assertEquals(LeadStatusEnum.NURTURING, lead.getStatus());
    }

    @Test
    public void shouldRestartSilenceWindowOnlyForActiveConversations() {
        LocalDateTime now = LocalDateTime.now();
        LeadEntity active = fixture.dueTelegramLead("tg-7", "Nima");
        LeadEntity completed = fixture.dueTelegramLead("tg-8", "Sina");
        completed.setConversationState(ConversationStateEnum.COMPLETED);
        LeadEntity removed = fixture.dueTelegramLead("tg-9", "Tara");
        policy.removeManually(removed, now);

        policy.restartSilenceWindow(active, now, INTERVAL);
        policy.restartSilenceWindow(completed, now, INTERVAL);
        policy.restartSilenceWindow(removed, now, INTERVAL);

        Assertions.assertEquals(now.plus(INTERVAL), active.getNextFollowupAt());
        Assertions.assertNull(completed.getNextFollowupAt());
        Assertions.assertNull(removed.getNextFollowupAt());
    }

    @Test
    public void shouldCheckEligibilityAndContactGap() {
        LocalDateTime now = LocalDateTime.now();
        LeadEntity lead = fixture.dueTelegramLead("tg-10", "Omid");

        Assertions.assertTrue(policy.isEligible(lead, now));
        lead.setLastContactedAt(now.minusMinutes(30));
        Assertions.assertTrue(policy.isWithinContactGap(lead, now, Duration.ofMinutes(120)));
        Assertions.assertFalse(policy.isWithinContactGap(lead, now, Duration.ZERO));

        lead.setStatus(LeadStatusEnum.LOST);
        Assertions.assertFalse(policy.isEligible(lead, now));
    }

    @Test
    public void shouldSelectAllowedReachableChannel() {
        LeadEntity lead = fixture.dueTelegramLead("tg-11", "Yas");
        lead.setWhatsappUserId("wa-11");
        FollowupCampaignEntity anyChannel = new FollowupCampaignEntity();
        FollowupCampaignEntity whatsappOnly = new FollowupCampaignEntity();
        whatsappOnly.setChannels(List.of(ChannelEnum.WHATSAPP));
        FollowupCampaignEntity linkedinOnly = new FollowupCampaignEntity();
        linkedinOnly.setChannels(List.of(ChannelEnum.LINKEDIN));

        Assertions.assertEquals(ChannelEnum.TELEGRAM, policy.selectChannel(anyChannel, lead));
        Assertions.assertEquals(ChannelEnum.WHATSAPP, policy.selectChannel(whatsappOnly, lead));
        Assertions.assertNull(policy.selectChannel(linkedinOnly, lead));
    }
}
