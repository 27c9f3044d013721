package com.leadengine.trigger.http;

import com.leadengine.api.dto.InteractionRecordRequestDTO;
import com.leadengine.api.dto.LeadDTO;
import com.leadengine.api.dto.LeadResolveRequestDTO;
import com.leadengine.api.dto.LeadResolveResponseDTO;
import com.leadengine.api.response.Response;
import com.leadengine.domain.lead.model.valobj.LeadResolution;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.trigger.application.command.LeadCommandService;
import com.leadengine.trigger.application.command.LeadResolveApplicationService;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.trigger.application.query.LeadQueryService;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 线索 API：识别、查询、移出跟进、互动与房源行为登记。
 */
@RestController
@RequestMapping("/api/v1/leads")
public class LeadController {

    private final LeadResolveApplicationService leadResolveApplicationService;
    private final LeadCommandService leadCommandService;
    private final LeadQueryService leadQueryService;
    private final LeadViewAssembler leadViewAssembler;

    public LeadController(LeadResolveApplicationService leadResolveApplicationService,
                          LeadCommandService leadCommandService,
                          LeadQueryService leadQueryService,
                          LeadViewAssembler leadViewAssembler) {
        this.leadResolveApplicationService = leadResolveApplicationService;
        this.leadCommandService = leadCommandService;
        this.leadQueryService = leadQueryService;
        this.leadViewAssembler = leadViewAssembler;
    }

    @PostMapping("/resolve")
    public Response<LeadResolveResponseDTO> resolve(@RequestBody LeadResolveRequestDTO request) {
        if (request == null || request.getTenantId() == null) {
            throw AppException.illegalParameter("tenantId 不能为空");
        }
        ObservedLeadFields observed = ObservedLeadFields.builder()
                .channel(ChannelEnum.fromCode(request.getChannel()))
                .channelUserId(request.getChannelUserId())
                .profileUrl(request.getProfileUrl())
                .phone(request.getPhone())
                .name(request.getName())
                .email(request.getEmail())
                .jobTitle(request.getJobTitle())
                .company(request.getCompany())
                .source(LeadSourceEnum.fromCode(request.getSource()))
                .language(LanguageEnum.fromCode(request.getLanguage()))
                .build();
        LeadResolution resolution = leadResolveApplicationService.resolve(request.getTenantId(), observed);
        LeadResolveResponseDTO data = new LeadResolveResponseDTO();
        data.setLead(leadViewAssembler.toLeadDTO(resolution.lead()));
        data.setCreated(resolution.created());
        return success(data);
    }

    @GetMapping("/{id}")
    public Response<LeadDTO> getLead(@PathVariable("id") Long leadId) {
        return success(leadQueryService.getLead(leadId));
    }

    @DeleteMapping("/{id}/pipeline")
    public Response<LeadDTO> removeFromPipeline(@PathVariable("id") Long leadId) {
        return success(leadViewAssembler.toLeadDTO(leadCommandService.removeFromPipeline(leadId)));
    }

    @PostMapping("/{id}/interactions")
    public Response<LeadDTO> recordInteraction(@PathVariable("id") Long leadId,
                                               @RequestBody InteractionRecordRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("请求体不能为空");
        }
        return success(leadViewAssembler.toLeadDTO(leadCommandService.recordInteraction(leadId,
                request.getChannel(), request.getDirection(), request.getText())));
    }

    @PostMapping("/{id}/viewed/{propertyId}")
    public Response<LeadDTO> markViewed(@PathVariable("id") Long leadId,
                                        @PathVariable("propertyId") Long propertyId) {
        return success(leadViewAssembler.toLeadDTO(leadCommandService.markViewed(leadId, propertyId)));
    }

    @PostMapping("/{id}/favorited/{propertyId}")
    public Response<LeadDTO> markFavorited(@PathVariable("id") Long leadId,
                                           @PathVariable("propertyId") Long propertyId) {
        return success(leadViewAssembler.toLeadDTO(leadCommandService.markFavorited(leadId, propertyId)));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
