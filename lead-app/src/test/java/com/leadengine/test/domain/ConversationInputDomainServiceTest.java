package com.leadengine.test.domain;

import com.leadengine.domain.conversation.model.valobj.SlotInput;
import com.leadengine.domain.conversation.service.ConversationInputDomainService;
import com.leadengine.domain.lead.service.LeadIdentityDomainService;
import com.leadengine.types.enums.ConversationSlotEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ConversationInputDomainServiceTest {

    private final ConversationInputDomainService inputDomainService =
            new ConversationInputDomainService(new LeadIdentityDomainService());

    @Test
    public void shouldPreferStructuredChoiceOverText() {
        SlotInput input = inputDomainService.parse(ConversationSlotEnum.BUDGET, "50k", "budget_3");

        Assertions.assertEquals(SlotInput.Kind.MATCH, input.kind());
        Assertions.assertEquals("3", input.value());
    }

    @Test
    public void shouldMapBudgetAmountsToBrackets() {
        Assertions.assertEquals("0", inputDomainService.parse(ConversationSlotEnum.BUDGET, "450k", null).value());
        Assertions.assertEquals("1", inputDomainService.parse(ConversationSlotEnum.BUDGET, "500000", null).value());
        Assertions.assertEquals("2", inputDomainService.parse(ConversationSlotEnum.BUDGET, "1.5 million", null).value());
        Assertions.assertEquals("4", inputDomainService.parse(ConversationSlotEnum.BUDGET, "$7m", null).value());
        Assertions.assertEquals(SlotInput.Kind.NONE,
                inputDomainService.parse(ConversationSlotEnum.BUDGET, "about 2m I guess", null).kind());
    }

    @Test
    public void shouldOnlyTreatPhoneShapedTextAsContact() {
        Assertions.assertEquals("+971501234567",
                inputDomainService.parse(ConversationSlotEnum.CONTACT, "+971 (50) 123-4567", null).value());
        Assertions.assertEquals(SlotInput.Kind.NONE,
                inputDomainService.parse(ConversationSlotEnum.CONTACT, "my budget is 2500000 and 3 rooms", null).kind());
        Assertions.assertEquals(SlotInput.Kind.NONE,
                inputDomainService.parse(ConversationSlotEnum.CONTACT, "12345", null).kind());
    }

    @Test
    public void shouldRejectChoiceForAnotherSlot() {
        SlotInput input = inputDomainService.parse(ConversationSlotEnum.GOAL, null, "budget_1");

        Assertions.assertEquals(SlotInput.Kind.INVALID, input.kind());
    }

    @Test
    public void shouldRejectOutOfRangeBudgetChoices() {
        Assertions.assertEquals(SlotInput.Kind.INVALID,
                inputDomainService.parse(ConversationSlotEnum.BUDGET, null, "budget_99999999999").kind());
        Assertions.assertEquals(SlotInput.Kind.INVALID,
                inputDomainService.parse(ConversationSlotEnum.BUDGET, null, "budget_5").kind());
        Assertions.assertEquals(SlotInput.Kind.INVALID,
                inputDomainService.parse(ConversationSlotEnum.BUDGET, null, "budget_-1").kind());
        Assertions.assertEquals("4", inputDomainService.parse(ConversationSlotEnum.BUDGET, null, "budget_4").value());
    }

    @Test
    public void shouldParseKeywordsInSeveralLanguages() {
        Assertions.assertEquals("fa", inputDomainService.parse(ConversationSlotEnum.LANGUAGE, "Farsi", null).value());
        Assertions.assertEquals("rent", inputDomainService.parse(ConversationSlotEnum.TRANSACTION_TYPE, "аренда", null).value());
        Assertions.assertEquals("yes", inputDomainService.parse(ConversationSlotEnum.REPORT, "Sure!", null).value());
        Assertions.assertEquals("townhouse", inputDomainService.parse(ConversationSlotEnum.PROPERTY_TYPE, "Townhouses", null).value());
    }

    @Test
    public void shouldAcceptSchedulingNoneOnlyAsChoice() {
        Assertions.assertEquals("none", inputDomainService.parse(ConversationSlotEnum.SCHEDULE, null, "schedule_none").value());
        Assertions.assertEquals(SlotInput.Kind.NONE, inputDomainService.parse(ConversationSlotEnum.SCHEDULE, "none", null).kind());
    }
}
