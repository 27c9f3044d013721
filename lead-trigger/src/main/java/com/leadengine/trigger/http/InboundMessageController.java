package com.leadengine.trigger.http;

import com.leadengine.api.dto.InboundMessageRequestDTO;
import com.leadengine.api.dto.InboundReplyDTO;
import com.leadengine.api.response.Response;
import com.leadengine.domain.conversation.model.valobj.AdvanceResult;
import com.leadengine.domain.conversation.model.valobj.InboundEnvelope;
import com.leadengine.trigger.application.command.InboundMessageApplicationService;
import com.leadengine.trigger.application.common.LeadViewAssembler;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

/**
 * 渠道入站消息 API。共享入口按启动令牌或会话路由，专属入口直接绑定租户。
 */
@RestController
@RequestMapping("/api/v1/inbound")
public class InboundMessageController {

    private final InboundMessageApplicationService inboundMessageApplicationService;
    private final LeadViewAssembler leadViewAssembler;

    public InboundMessageController(InboundMessageApplicationService inboundMessageApplicationService,
                                    LeadViewAssembler leadViewAssembler) {
        this.inboundMessageApplicationService = inboundMessageApplicationService;
        this.leadViewAssembler = leadViewAssembler;
    }

    @PostMapping
    public Response<InboundReplyDTO> receiveShared(@RequestBody InboundMessageRequestDTO request) {
        return success(handle(request, null));
    }

    @PostMapping("/{tenantId}")
    public Response<InboundReplyDTO> receiveDedicated(@PathVariable("tenantId") Long tenantId,
                                                      @RequestBody InboundMessageRequestDTO request) {
        return success(handle(request, tenantId));
    }

    private InboundReplyDTO handle(InboundMessageRequestDTO request, Long dedicatedTenantId) {
        if (request == null) {
            throw AppException.illegalParameter("请求体不能为空");
        }
        InboundEnvelope envelope = InboundEnvelope.builder()
                .channel(ChannelEnum.fromCode(request.getChannel()))
                .externalUserId(request.getExternalUserId())
                .displayName(request.getDisplayName())
                .text(request.getText())
                .structuredChoiceId(request.getChoiceId())
                .mediaRef(request.getMediaRef())
                .contactPhone(request.getContactPhone())
                .build();
        InboundMessageApplicationService.InboundResult result =
                inboundMessageApplicationService.handle(envelope, dedicatedTenantId);

        InboundReplyDTO dto = new InboundReplyDTO();
        dto.setRouted(result.decision().routed());
        dto.setTenantId(result.decision().tenantId());
        dto.setInterrupted(Boolean.FALSE);
        dto.setOutbound(new ArrayList<>());
        if (result.lead() != null) {
            dto.setLeadId(result.lead().getId());
            dto.setConversationState(result.lead().getConversationState() == null
                    ? null : result.lead().getConversationState().getCode());
        }
        AdvanceResult advance = result.advance();
        if (advance != null) {
            dto.setReply(advance.reply());
            dto.setInterrupted(advance.interrupted());
            dto.setOutbound(leadViewAssembler.toOutboundDTOs(advance.outboundRequests()));
        }
        return dto;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
