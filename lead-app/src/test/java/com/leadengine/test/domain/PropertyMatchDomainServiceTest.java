package com.leadengine.test.domain;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.domain.matching.model.valobj.MatchEvaluation;
import com.leadengine.domain.matching.service.PropertyMatchDomainService;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;

public class PropertyMatchDomainServiceTest {

    private final PropertyMatchDomainService matchDomainService = new PropertyMatchDomainService();

    @Test
    public void shouldMatchOnlyLeadsWhoseCriteriaAdmitProperty() {
        PropertyEntity property = property(1L, "1200000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, "Dubai Marina");
        LeadEntity inRange = lead(11L, "1000000", "2000000", PropertyTypeEnum.APARTMENT);
        LeadEntity tooCheap = lead(12L, "300000", "800000", PropertyTypeEnum.APARTMENT);
        LeadEntity wrongType = lead(13L, "1000000", "2000000", PropertyTypeEnum.VILLA);

        List<Long> matched = matchDomainService.matchForProperty(property, List.of(inRange, tooCheap, wrongType));

        Assertions.assertEquals(List.of(11L), matched);
    }

    @Test
    public void shouldTreatMissingCriteriaAsWildcard() {
        PropertyEntity property = property(1L, "9000000", PropertyTypeEnum.PENTHOUSE, TransactionTypeEnum.BUY, "Palm Jumeirah");
        LeadEntity openLead = lead(21L, null, null, null);

        MatchEvaluation evaluation = matchDomainService.evaluate(openLead, property);

        Assertions.assertTrue(evaluation.matched());
        Assertions.assertEquals(1D, evaluation.score());
        Assertions.assertTrue(evaluation.reasons().isEmpty());
    }

    @Test
    public void shouldCompareLocationCaseInsensitively() {
        PropertyEntity property = property(1L, "1500000", null, null, "  dubai marina ");
        LeadEntity marina = lead(31L, null, null, null);
        marina.setPreferredLocations(new LinkedHashSet<>(List.of("Downtown", "Dubai Marina")));
        LeadEntity downtownOnly = lead(32L, null, null, null);
        downtownOnly.setPreferredLocations(new LinkedHashSet<>(List.of("Downtown")));

        Assertions.assertEquals(List.of(31L), matchDomainService.matchForProperty(property, List.of(marina, downtownOnly)));
        Assertions.assertEquals(List.of(PropertyMatchDomainService.REASON_LOCATION),
                matchDomainService.evaluate(marina, property).reasons());
    }

    @Test
    public void shouldRespectBedroomRange() {
        PropertyEntity property = property(1L, null, null, null, null);
        property.setBedrooms(3);
        LeadEntity twoToThree = lead(41L, null, null, null);
        twoToThree.setBedroomsMin(2);
        twoToThree.setBedroomsMax(3);
        LeadEntity fourPlus = lead(42L, null, null, null);
        fourPlus.setBedroomsMin(4);

        Assertions.assertEquals(List.of(41L), matchDomainService.matchForProperty(property, List.of(twoToThree, fourPlus)));
    }

    @Test
    public void shouldExcludeClosedUnreachableAndForeignTenantLeads() {
        PropertyEntity property = property(1L, "1200000", null, null, null);
        LeadEntity closed = lead(51L, null, null, null);
        closed.setStatus(LeadStatusEnum.WON);
        LeadEntity unreachable = lead(52L, null, null, null);
        unreachable.setTelegramUserId(null);
        unreachable.setPhone("+971500000000");
        LeadEntity otherTenant = lead(53L, null, null, null);
        otherTenant.setTenantId(99L);
        LeadEntity nurturing = lead(54L, null, null, null);
        nurturing.setStatus(LeadStatusEnum.NURTURING);

        List<Long> matched = matchDomainService.matchForProperty(property, List.of(closed, unreachable, otherTenant, nurturing));

        Assertions.assertEquals(List.of(54L), matched);
    }

    @Test
    public void shouldIncludeQualifiedLeadOnlyOnceChannelIdentityIsKnown() {
        PropertyEntity property = property(1L, "2000000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, null);
        LeadEntity lead = lead(81L, "1500000", "2500000", PropertyTypeEnum.APARTMENT);
        lead.setTransactionType(TransactionTypeEnum.BUY);
        lead.setTelegramUserId(null);
        lead.setProfileUrl("https://www.linkedin.com/in/new-lead");

        Assertions.assertTrue(matchDomainService.evaluate(lead, property).matched());
        Assertions.assertTrue(matchDomainService.matchForProperty(property, List.of(lead)).isEmpty());

        lead.setWhatsappUserId("971501112233");
        Assertions.assertEquals(List.of(81L), matchDomainService.matchForProperty(property, List.of(lead)));

        lead.setWhatsappUserId(null);
        lead.setTelegramUserId("tg-81");
        Assertions.assertEquals(List.of(81L), matchDomainService.matchForProperty(property, List.of(lead)));
    }

    @Test
    public void shouldMatchAvailablePropertiesForLead() {
        LeadEntity lead = lead(61L, "1000000", "2000000", PropertyTypeEnum.APARTMENT);
        PropertyEntity fits = property(1L, "1500000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, null);
        PropertyEntity sold = property(2L, "1500000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, null);
        sold.setAvailable(false);
        PropertyEntity expensive = property(3L, "2500000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, null);

        Assertions.assertEquals(List.of(1L), matchDomainService.matchForLead(lead, List.of(fits, sold, expensive)));
    }

    @Test
    public void shouldScoreByMatchedCriteria() {
        LeadEntity lead = lead(71L, "1000000", "2000000", PropertyTypeEnum.APARTMENT);
        lead.setTransactionType(TransactionTypeEnum.BUY);
        PropertyEntity property = property(1L, "1000000", PropertyTypeEnum.APARTMENT, TransactionTypeEnum.BUY, "JVC");

        MatchEvaluation evaluation = matchDomainService.evaluate(lead, property);

        Assertions.assertTrue(evaluation.matched());
        Assertions.assertEquals(1D, evaluation.score());
        Assertions.assertEquals(List.of(PropertyMatchDomainService.REASON_BUDGET,
                PropertyMatchDomainService.REASON_PROPERTY_TYPE,
                PropertyMatchDomainService.REASON_TRANSACTION_TYPE), evaluation.reasons());
    }

    private PropertyEntity property(Long id, String price, PropertyTypeEnum type, TransactionTypeEnum transaction, String location) {
        PropertyEntity property = new PropertyEntity();
        property.setId(id);
        property.setTenantId(7L);
        property.setName("Listing " + id);
        property.setPrice(price == null ? null : new BigDecimal(price));
        property.setPropertyType(type);
        property.setTransactionType(transaction);
        property.setLocation(location);
        property.setAvailable(true);
        return property;
    }

    private LeadEntity lead(Long id, String budgetMin, String budgetMax, PropertyTypeEnum type) {
        LeadEntity lead = new LeadEntity();
        lead.setId(id);
        lead.setTenantId(7L);
        lead.setStatus(LeadStatusEnum.OPEN);
        lead.setTelegramUserId("tg-" + id);
        lead.setBudgetMin(budgetMin == null ? null : new BigDecimal(budgetMin));
        lead.setBudgetMax(budgetMax == null ? null : new BigDecimal(budgetMax));
        lead.setPropertyType(type);
        return lead;
    }
}
