package com.leadengine.trigger.http;

import com.leadengine.api.dto.CampaignCreateRequestDTO;
import com.leadengine.api.dto.CampaignDTO;
import com.leadengine.api.dto.CampaignRunResultDTO;
import com.leadengine.api.dto.FollowupCycleResultDTO;
import com.leadengine.api.response.Response;
import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.followup.model.valobj.CampaignRunResult;
import com.leadengine.domain.followup.model.valobj.CycleResult;
import com.leadengine.trigger.application.command.FollowupCampaignApplicationService;
import com.leadengine.trigger.application.command.FollowupCycleApplicationService;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 跟进运维 API：手动触发一轮跟进、创建活动、执行到期活动。
 */
@RestController
@RequestMapping("/api/v1")
public class FollowupController {

    private final FollowupCycleApplicationService followupCycleApplicationService;
    private final FollowupCampaignApplicationService followupCampaignApplicationService;
    private final LeadViewAssembler leadViewAssembler;

    public FollowupController(FollowupCycleApplicationService followupCycleApplicationService,
                              FollowupCampaignApplicationService followupCampaignApplicationService,
                              LeadViewAssembler leadViewAssembler) {
        this.followupCycleApplicationService = followupCycleApplicationService;
        this.followupCampaignApplicationService = followupCampaignApplicationService;
        this.leadViewAssembler = leadViewAssembler;
    }

    @PostMapping("/followups/cycle")
    public Response<FollowupCycleResultDTO> runCycle(@RequestParam(value = "batchSize", required = false) Integer batchSize) {
        CycleResult result = batchSize == null
                ? followupCycleApplicationService.runCycle()
                : followupCycleApplicationService.runCycle(batchSize);
        FollowupCycleResultDTO dto = new FollowupCycleResultDTO();
        dto.setAttempted(result.attempted());
        dto.setSucceeded(result.succeeded());
        dto.setFailed(result.failed());
        return success(dto);
    }

    @PostMapping("/campaigns")
    public Response<CampaignDTO> createCampaign(@RequestBody CampaignCreateRequestDTO request) {
        if (request == null) {
            throw AppException.illegalParameter("请求体不能为空");
        }
        FollowupCampaignEntity campaign = new FollowupCampaignEntity();
        campaign.setTenantId(request.getTenantId());
        campaign.setName(request.getName());
        campaign.setTargetStatuses(parse(request.getTargetStatuses(), LeadStatusEnum::fromCode));
        campaign.setMinScore(request.getMinScore());
        campaign.setMaxScore(request.getMaxScore());
        campaign.setTargetSources(parse(request.getTargetSources(), LeadSourceEnum::fromCode));
        campaign.setMessageTemplate(request.getMessageTemplate());
        campaign.setChannels(parse(request.getChannels(), ChannelEnum::fromCode));
        campaign.setScheduledAt(request.getScheduledAt());
        return success(leadViewAssembler.toCampaignDTO(followupCampaignApplicationService.create(campaign)));
    }

    @PostMapping("/campaigns/run-due")
    public Response<List<CampaignRunResultDTO>> runDueCampaigns() {
        List<CampaignRunResultDTO> data = new ArrayList<>();
        for (CampaignRunResult result : followupCampaignApplicationService.runDueCampaigns()) {
            CampaignRunResultDTO dto = new CampaignRunResultDTO();
            dto.setCampaignId(result.campaignId());
            dto.setTargeted(result.targeted());
            dto.setSent(result.sent());
            dto.setFailed(result.failed());
            data.add(dto);
        }
        return success(data);
    }

    private <E> List<E> parse(List<String> codes, Function<String, E> parser) {
        List<E> values = new ArrayList<>();
        if (codes == null) {
            return values;
        }
        for (String code : codes) {
            E value = parser.apply(code);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
