package com.leadengine.test.application;

import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.followup.model.valobj.CampaignRunResult;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.entity.LeadInteractionEntity;
import com.leadengine.test.support.InMemoryFollowupCampaignRepository;
import com.leadengine.test.support.LeadEngineFixture;
import com.leadengine.trigger.application.command.FollowupCampaignApplicationService;
import com.leadengine.types.enums.CampaignStatusEnum;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class FollowupCampaignApplicationServiceTest {

    private LeadEngineFixture fixture;
    private InMemoryFollowupCampaignRepository campaignRepository;
    private FollowupCampaignApplicationService campaignService;

    @BeforeEach
    public void setUp() {
        fixture = new LeadEngineFixture();
        campaignRepository = new InMemoryFollowupCampaignRepository();
        campaignService = new FollowupCampaignApplicationService(campaignRepository, fixture.leadRepository,
                fixture.channelSender, fixture.followupPolicyDomainService, fixture.persistence,
                fixture.boundedRetry, 5, 1000);
    }

    @Test
    public void shouldCreateDraftOrScheduledCampaign() {
        FollowupCampaignEntity draft = campaignService.create(campaign(null));
        FollowupCampaignEntity scheduled = campaignService.create(campaign(LocalDateTime.now().plusHours(2)));

        Assertions.assertEquals(CampaignStatusEnum.DRAFT, draft.getStatus());
        Assertions.assertEquals(CampaignStatusEnum.SCHEDULED, scheduled.getStatus());
        Assertions.assertTrue(campaignService.runDueCampaigns().isEmpty());
    }

    @Test
    public void shouldRejectCampaignWithInvalidScoreRange() {
        FollowupCampaignEntity invalid = campaign(null);
        invalid.setMinScore(80);
        invalid.setMaxScore(20);

        Assertions.assertThrows(AppException.class, () -> campaignService.create(invalid));
    }

    @Test
    public void shouldSendDueCampaignToTargetedLeadsOnly() {
        LeadEntity target = lead("tg-1", "Farid Rahimi", LeadSourceEnum.TELEGRAM, 30);
        LeadEntity lowScore = lead("tg-2", "Low", LeadSourceEnum.TELEGRAM, 5);
        LeadEntity otherSource = lead("tg-3", "Ref", LeadSourceEnum.REFERRAL, 30);
        LeadEntity noChannel = lead(null, "Phone Only", LeadSourceEnum.TELEGRAM, 30);
        noChannel.setPhone("+971504444444");
        for (LeadEntity lead : List.of(target, lowScore, otherSource, noChannel)) {
            fixture.leadRepository.put(lead);
        }
        FollowupCampaignEntity campaign = campaign(LocalDateTime.now().minusMinutes(1));
        campaign.setMinScore(20);
        campaign.setTargetSources(List.of(LeadSourceEnum.TELEGRAM));
        campaignService.create(campaign);

        List<CampaignRunResult> results = campaignService.runDueCampaigns();

        Assertions.assertEquals(List.of(new CampaignRunResult(campaign.getId(), 1, 1, 0)), results);
        Assertions.assertEquals("Hello Farid, new waterfront launches are open this week.",
                fixture.channelSender.delivered().get(0).text());
        FollowupCampaignEntity stored = campaignRepository.findById(campaign.getId());
        Assertions.assertEquals(CampaignStatusEnum.COMPLETED, stored.getStatus());
        Assertions.assertEquals(1, stored.getTotalSent());
        Assertions.assertNotNull(stored.getExecutedAt());

        LeadEntity updated = fixture.leadRepository.findById(target.getId());
        Assertions.assertEquals(0, updated.getFollowupCount());
        Assertions.assertEquals(1, updated.getMessagesSent());
        LeadInteractionEntity interaction = fixture.interactionRepository.findRecentByLeadId(target.getId(), 1).get(0);
        Assertions.assertEquals(campaign.getId(), interaction.getCampaignId());
        Assertions.assertTrue(campaignService.runDueCampaigns().isEmpty());
    }

    @Test
    public void shouldCountFailedDeliveries() {
        fixture.leadRepository.put(lead("tg-4", "Navid", LeadSourceEnum.TELEGRAM, 10));
        fixture.channelSender.failAlways(false);
        FollowupCampaignEntity campaign = campaignService.create(campaign(LocalDateTime.now().minusMinutes(1)));

        List<CampaignRunResult> results = campaignService.runDueCampaigns();

        Assertions.assertEquals(new CampaignRunResult(campaign.getId(), 1, 0, 1), results.get(0));
        Assertions.assertEquals(1, campaignRepository.findById(campaign.getId()).getTotalFailed());
    }

    @Test
    public void shouldUseOnlyAllowedChannels() {
        LeadEntity lead = lead("tg-5", "Yas", LeadSourceEnum.TELEGRAM, 10);
        lead.setWhatsappUserId("wa-5");
        fixture.leadRepository.put(lead);
        FollowupCampaignEntity campaign = campaign(LocalDateTime.now().minusMinutes(1));
        campaign.setChannels(List.of(ChannelEnum.WHATSAPP));
        campaignService.create(campaign);

        campaignService.runDueCampaigns();

        Assertions.assertEquals(ChannelEnum.WHATSAPP, fixture.channelSender.delivered().get(0).channel());
        Assertions.assertEquals("wa-5", fixture.channelSender.delivered().get(0).recipient());
    }

    private FollowupCampaignEntity campaign(LocalDateTime scheduledAt) {
        FollowupCampaignEntity campaign = new FollowupCampaignEntity();
        campaign.setTenantId(LeadEngineFixture.TENANT_ID);
        campaign.setName("Waterfront launch");
        campaign.setMessageTemplate("Hello {name}, new waterfront launches are open this week.");
        campaign.setScheduledAt(scheduledAt);
        return campaign;
    }

    private LeadEntity lead(String telegramUserId, String name, LeadSourceEnum source, int score) {
        LeadEntity lead = fixture.dueTelegramLead(telegramUserId, name);
        lead.setNextFollowupAt(null);
        lead.setStatus(LeadStatusEnum.OPEN);
        lead.setSource(source);
        lead.setScore(score);
        return lead;
    }
}
