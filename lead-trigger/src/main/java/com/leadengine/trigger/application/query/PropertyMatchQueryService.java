package com.leadengine.trigger.application.query;

import com.leadengine.api.dto.PropertyMatchDTO;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.matching.adapter.repository.IPropertyRepository;
import com.leadengine.domain.matching.model.entity.PropertyEntity;
import com.leadengine.domain.matching.model.valobj.MatchEvaluation;
import com.leadengine.domain.matching.service.PropertyMatchDomainService;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 房源-线索匹配读用例，不写任何数据。
 */
@Service
public class PropertyMatchQueryService {

    private static final List<LeadStatusEnum> CANDIDATE_STATUSES = List.of(LeadStatusEnum.OPEN, LeadStatusEnum.NURTURING);

    private final IPropertyRepository propertyRepository;
    private final ILeadRepository leadRepository;
    private final PropertyMatchDomainService propertyMatchDomainService;

    public PropertyMatchQueryService(IPropertyRepository propertyRepository,
                                     ILeadRepository leadRepository,
                                     PropertyMatchDomainService propertyMatchDomainService) {
        this.propertyRepository = propertyRepository;
        this.leadRepository = leadRepository;
        this.propertyMatchDomainService = propertyMatchDomainService;
    }

    public List<PropertyMatchDTO> matchForProperty(Long propertyId) {
        PropertyEntity property = propertyRepository.findById(propertyId);
        if (property == null) {
            throw AppException.notFound("Property not found: " + propertyId);
        }
        List<LeadEntity> candidates = leadRepository.findByTenantAndStatuses(property.getTenantId(), CANDIDATE_STATUSES);
        Map<Long, LeadEntity> byId = candidates.stream()
                .collect(Collectors.toMap(LeadEntity::getId, Function.identity(), (left, right) -> left));
        List<PropertyMatchDTO> matches = new ArrayList<>();
        for (Long leadId : propertyMatchDomainService.matchForProperty(property, candidates)) {
            matches.add(toDTO(property, byId.get(leadId)));
        }
        matches.sort(Comparator.comparing(PropertyMatchDTO::getMatchScore).reversed());
        return matches;
    }

    public List<PropertyMatchDTO> matchForLead(Long leadId) {
        LeadEntity lead = leadRepository.findById(leadId);
        if (lead == null) {
            throw AppException.notFound("Lead not found: " + leadId);
        }
        List<PropertyEntity> properties = propertyRepository.findAvailableByTenant(lead.getTenantId());
        Map<Long, PropertyEntity> byId = properties.stream()
                .collect(Collectors.toMap(PropertyEntity::getId, Function.identity(), (left, right) -> left));
        List<PropertyMatchDTO> matches = new ArrayList<>();
        for (Long propertyId : propertyMatchDomainService.matchForLead(lead, properties)) {
            matches.add(toDTO(byId.get(propertyId), lead));
        }
        matches.sort(Comparator.comparing(PropertyMatchDTO::getMatchScore).reversed());
        return matches;
    }

    private PropertyMatchDTO toDTO(PropertyEntity property, LeadEntity lead) {
        MatchEvaluation evaluation = propertyMatchDomainService.evaluate(lead, property);
        PropertyMatchDTO dto = new PropertyMatchDTO();
        dto.setPropertyId(property.getId());
        dto.setLeadId(lead.getId());
        dto.setMatchScore(evaluation.score());
        dto.setMatchReasons(evaluation.reasons());
        return dto;
    }
}
