package com.leadengine.domain.matching.service;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.domain.matching.model.valobj.MatchEvaluation;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 房源-线索匹配判定，无副作用。
 * <p>
 * 任一侧未设置的条件视为通配；线索没有地点偏好时匹配所有地点。
 * 只有未关闭且至少有一个可触达渠道的线索才是有效结果。
 * </p>
 */
@Service
public class PropertyMatchDomainService {

    public static final String REASON_BUDGET = "budget";
    public static final String REASON_PROPERTY_TYPE = "property_type";
    public static final String REASON_TRANSACTION_TYPE = "transaction_type";
    public static final String REASON_LOCATION = "location";
    public static final String REASON_BEDROOMS = "bedrooms";

    public boolean isEligibleLead(LeadEntity lead) {
        return lead != null
                && lead.getId() != null
                && (lead.getStatus() == null || !lead.getStatus().isClosed())
                && lead.hasReachableChannel();
    }

    public MatchEvaluation evaluate(LeadEntity lead, PropertyEntity property) {
        if (lead == null || property == null) {
            return MatchEvaluation.rejected();
        }
        int compared = 0;
        List<String> reasons = new ArrayList<>();

        BigDecimal price = property.getPrice();
        if (price != null && (lead.getBudgetMin() != null || lead.getBudgetMax() != null)) {
            compared++;
            if (lead.getBudgetMin() != null && price.compareTo(lead.getBudgetMin()) < 0) {
                return MatchEvaluation.rejected();
            }
            if (lead.getBudgetMax() != null && price.compareTo(lead.getBudgetMax()) > 0) {
                return MatchEvaluation.rejected();
            }
            reasons.add(REASON_BUDGET);
        }

        if (property.getPropertyType() != null && lead.getPropertyType() != null) {
            compared++;
            if (property.getPropertyType() != lead.getPropertyType()) {
                return MatchEvaluation.rejected();
            }
            reasons.add(REASON_PROPERTY_TYPE);
        }

        if (property.getTransactionType() != null && lead.getTransactionType() != null) {
            compared++;
            if (property.getTransactionType() != lead.getTransactionType()) {
                return MatchEvaluation.rejected();
            }
            reasons.add(REASON_TRANSACTION_TYPE);
        }

        String location = normalize(property.getLocation());
        if (location != null && !isEmpty(lead.getPreferredLocations())) {
            compared++;
            if (!containsLocation(lead.getPreferredLocations(), location)) {
                return MatchEvaluation.rejected();
            }
            reasons.add(REASON_LOCATION);
        }

        Integer bedrooms = property.getBedrooms();
        if (bedrooms != null && (lead.getBedroomsMin() != null || lead.getBedroomsMax() != null)) {
            compared++;
            if (lead.getBedroomsMin() != null && bedrooms < lead.getBedroomsMin()) {
                return MatchEvaluation.rejected();
            }
            if (lead.getBedroomsMax() != null && bedrooms > lead.getBedroomsMax()) {
                return MatchEvaluation.rejected();
            }
            reasons.add(REASON_BEDROOMS);
        }

        double score = compared == 0 ? 1D : (double) reasons.size() / compared;
        return new MatchEvaluation(true, score, reasons);
    }

    public List<Long> matchForProperty(PropertyEntity property, Collection<LeadEntity> candidates) {
        List<Long> leadIds = new ArrayList<>();
        if (property == null || isEmpty(candidates)) {
            return leadIds;
        }
        for (LeadEntity lead : candidates) {
            if (!sameTenant(lead, property) || !isEligibleLead(lead)) {
                continue;
            }
            if (evaluate(lead, property).matched()) {
                leadIds.add(lead.getId());
            }
        }
        return leadIds;
    }

    public List<Long> matchForLead(LeadEntity lead, Collection<PropertyEntity> properties) {
        List<Long> propertyIds = new ArrayList<>();
        if (!isEligibleLead(lead) || isEmpty(properties)) {
            return propertyIds;
        }
        for (PropertyEntity property : properties) {
            if (property == null || !property.isAvailable() || !sameTenant(lead, property)) {
                continue;
            }
            if (evaluate(lead, property).matched()) {
                propertyIds.add(property.getId());
            }
        }
        return propertyIds;
    }

    private boolean containsLocation(Collection<String> preferred, String location) {
        for (String candidate : preferred) {
            if (location.equals(normalize(candidate))) {
                return true;
            }
        }
        return false;
    }

    private boolean sameTenant(LeadEntity lead, PropertyEntity property) {
        return lead.getTenantId() == null || property.getTenantId() == null
                || lead.getTenantId().equals(property.getTenantId());
    }

    private String normalize(String value) {
        String trimmed = StringUtils.trimToNull(value);
        return trimmed == null ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    private boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
