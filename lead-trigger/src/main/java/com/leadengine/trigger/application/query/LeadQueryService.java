package com.leadengine.trigger.application.query;

import com.leadengine.api.dto.LeadDTO;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.types.exception.AppException;
import org.springframework.stereotype.Service;

/**
 * 线索读用例。
 */
@Service
public class LeadQueryService {

    private final ILeadRepository leadRepository;
    private final LeadViewAssembler leadViewAssembler;

    public LeadQueryService(ILeadRepository leadRepository, LeadViewAssembler leadViewAssembler) {
        this.leadRepository = leadRepository;
        this.leadViewAssembler = leadViewAssembler;
    }

    public LeadDTO getLead(Long leadId) {
        if (leadId == null) {
            throw AppException.illegalParameter("leadId 不能为空");
        }
        LeadEntity lead = leadRepository.findById(leadId);
        if (lead == null) {
            throw AppException.notFound("Lead not found: " + leadId);
        }
        return leadViewAssembler.toLeadDTO(lead);
    }
}
