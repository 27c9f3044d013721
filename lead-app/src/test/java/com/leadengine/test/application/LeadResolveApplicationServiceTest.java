package com.leadengine.test.application;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.LeadResolution;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.test.support.InMemoryLeadRepository;
import com.leadengine.test.support.LeadEngineFixture;
import com.leadengine.trigger.application.command.LeadResolveApplicationService;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

public class LeadResolveApplicationServiceTest {

    private static final long TENANT = LeadEngineFixture.TENANT_ID;

    private LeadEngineFixture fixture;
    private LeadResolveApplicationService resolveService;

    @BeforeEach
    public void setUp() {
        fixture = new LeadEngineFixture();
        resolveService = fixture.leadResolve;
    }

    @Test
    public void shouldCreateLeadOnFirstSightAndReturnSameLeadAfterwards() {
        ObservedLeadFields observed = telegram("tg-100", "Omid");

        LeadResolution first = resolveService.resolve(TENANT, observed);
        LeadResolution second = resolveService.resolve(TENANT, observed);

        Assertions.assertTrue(first.created());
        Assertions.assertFalse(second.created());
        Assertions.assertEquals(first.lead().getId(), second.lead().getId());
        Assertions.assertEquals(1, fixture.leadRepository.size());
        Assertions.assertEquals(LeadStatusEnum.OPEN, first.lead().getStatus());
        Assertions.assertEquals(ConversationStateEnum.START, first.lead().getConversationState());
        Assertions.assertEquals(LeadSourceEnum.TELEGRAM, first.lead().getSource());
    }

    @Test
    public void shouldFillEmptyFieldsWithoutOverwritingKnownOnes() {
        resolveService.resolve(TENANT, telegram("tg-200", "Omid"));

        LeadResolution merged = resolveService.resolve(TENANT, ObservedLeadFields.builder()
                .channel(ChannelEnum.TELEGRAM)
                .channelUserId("tg-200")
                .name("Someone Else")
                .email("Omid@Example.com ")
                .phone("+971 50 765 4321")
                .build());

        LeadEntity stored = fixture.leadRepository.findById(merged.lead().getId());
        Assertions.assertEquals("Omid", stored.getName());
        Assertions.assertEquals("omid@example.com", stored.getEmail());
        Assertions.assertEquals("+971507654321", stored.getPhone());
        Assertions.assertTrue(stored.getScore() > 0);
    }

    @Test
    public void shouldPreferProfileUrlOverChannelAndPhone() {
        LeadEntity linkedin = resolveService.resolve(TENANT, ObservedLeadFields.builder()
                .profileUrl("https://linkedin.com/in/omid/")
                .build()).lead();
        LeadEntity byPhone = resolveService.resolve(TENANT, ObservedLeadFields.builder()
                .phone("+971501111111")
                .build()).lead();

        LeadResolution resolution = resolveService.resolve(TENANT, ObservedLeadFields.builder()
                .profileUrl("HTTPS://LINKEDIN.COM/IN/OMID")
                .phone("+971501111111")
                .build());

        Assertions.assertEquals(linkedin.getId(), resolution.lead().getId());
        Assertions.assertNotEquals(byPhone.getId(), resolution.lead().getId());
        Assertions.assertNull(fixture.leadRepository.findById(linkedin.getId()).getPhone());
    }

    @Test
    public void shouldKeepTenantsApart() {
        LeadResolution first = resolveService.resolve(TENANT, telegram("tg-300", "A"));
        LeadResolution other = resolveService.resolve(TENANT + 1, telegram("tg-300", "A"));

        Assertions.assertTrue(other.created());
        Assertions.assertNotEquals(first.lead().getId(), other.lead().getId());
    }

    @Test
    public void shouldMergeIntoWinnerWhenCreationRaces() {
        LeadEntity winner = new LeadEntity();
        winner.setTenantId(TENANT);
        winner.setTelegramUserId("tg-400");
        winner.setStatus(LeadStatusEnum.OPEN);
        AtomicBoolean raced = new AtomicBoolean();
        InMemoryLeadRepository racingRepository = new InMemoryLeadRepository() {
            @Override
            public LeadEntity findByChannelUserId(Long tenantId, ChannelEnum channel, String channelUserId) {
                LeadEntity found = super.findByChannelUserId(tenantId, channel, channelUserId);
                if (found == null && raced.compareAndSet(false, true)) {
                    put(winner);
                }
                return found;
            }
        };
        LeadResolveApplicationService service = new LeadResolveApplicationService(
                racingRepository, fixture.identityDomainService, fixture.scoringDomainService);

        LeadResolution resolution = service.resolve(TENANT, telegram("tg-400", "Late Writer"));

        Assertions.assertFalse(resolution.created());
        Assertions.assertEquals(winner.getId(), resolution.lead().getId());
        Assertions.assertEquals("Late Writer", racingRepository.findById(winner.getId()).getName());
        Assertions.assertEquals(1, racingRepository.size());
    }

    @Test
    public void shouldSkipIdentityKeyOwnedByAnotherLead() {
        LeadEntity phoneOwner = resolveService.resolve(TENANT, ObservedLeadFields.builder().phone("+971502222222").build()).lead();
        LeadEntity telegramLead = resolveService.resolve(TENANT, telegram("tg-500", "B")).lead();

        resolveService.resolve(TENANT, ObservedLeadFields.builder()
                .channel(ChannelEnum.TELEGRAM)
                .channelUserId("tg-500")
                .phone("+971502222222")
                .build());

        Assertions.assertNull(fixture.leadRepository.findById(telegramLead.getId()).getPhone());
        Assertions.assertEquals("+971502222222", fixture.leadRepository.findById(phoneOwner.getId()).getPhone());
    }

    @Test
    public void shouldRejectObservationWithoutIdentityKey() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> resolveService.resolve(TENANT, ObservedLeadFields.builder().name("Nobody").build()));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectMissingTenant() {
        Assertions.assertThrows(AppException.class, () -> resolveService.resolve(null, telegram("tg-600", "C")));
    }

    private ObservedLeadFields telegram(String userId, String name) {
        return ObservedLeadFields.builder()
                .channel(ChannelEnum.TELEGRAM)
                .channelUserId(userId)
                .name(name)
                .build();
    }
}
