package com.leadengine.trigger.application.command;

import com.leadengine.domain.conversation.model.valobj.AdvanceResult;
import com.leadengine.domain.conversation.model.valobj.InboundEnvelope;
import com.leadengine.domain.conversation.service.ConversationEngineDomainService;
import com.leadengine.domain.conversation.service.ConversationInputDomainService;
import com.leadengine.domain.lead.adapter.repository.ILeadRepository;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.LeadResolution;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.domain.session.model.valobj.RouteDecision;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationSlotEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 入站消息编排：路由 -> 线索识别 -> 会话推进 -> 持久化，返回回复与出站请求。
 */
@Slf4j
@Service
public class InboundMessageApplicationService {

    private static final int MAX_PERSIST_ATTEMPTS = 2;

    private final SessionRoutingApplicationService sessionRoutingApplicationService;
    private final LeadResolveApplicationService leadResolveApplicationService;
    private final LeadPersistenceApplicationService leadPersistenceApplicationService;
    private final ConversationEngineDomainService conversationEngineDomainService;
    private final ILeadRepository leadRepository;

    public InboundMessageApplicationService(SessionRoutingApplicationService sessionRoutingApplicationService,
                                            LeadResolveApplicationService leadResolveApplicationService,
                                            LeadPersistenceApplicationService leadPersistenceApplicationService,
                                            ConversationEngineDomainService conversationEngineDomainService,
                                            ILeadRepository leadRepository) {
        this.sessionRoutingApplicationService = sessionRoutingApplicationService;
        this.leadResolveApplicationService = leadResolveApplicationService;
        this.leadPersistenceApplicationService = leadPersistenceApplicationService;
        this.conversationEngineDomainService = conversationEngineDomainService;
        this.leadRepository = leadRepository;
    }

    /**
     * 处理一条入站消息
     *
     * @param dedicatedTenantId 专属入口的租户 ID；共享入口传 null，由启动令牌或会话决定租户
     */
    public InboundResult handle(InboundEnvelope envelope, Long dedicatedTenantId) {
        validate(envelope);
        ChannelEnum channel = envelope.getChannel();
        String externalUserId = envelope.getExternalUserId().trim();

        SessionRoutingApplicationService.RoutedText routed =
                sessionRoutingApplicationService.route(channel, externalUserId, envelope.getText(), dedicatedTenantId);
        if (!routed.decision().routed()) {
            return InboundResult.notRouted();
        }

        ObservedLeadFields observed = ObservedLeadFields.builder()
                .channel(channel)
                .channelUserId(externalUserId)
                .name(envelope.getDisplayName())
                .phone(envelope.getContactPhone())
                .build();
        LeadResolution resolution = leadResolveApplicationService.resolve(routed.decision().tenantId(), observed);

        String text = StringUtils.trimToNull(routed.text());
        String inboundLog = inboundLogText(text, envelope);
        LeadEntity lead = resolution.lead();
        for (int attempt = 1; attempt <= MAX_PERSIST_ATTEMPTS; attempt++) {
            String choiceId = choiceOf(lead, envelope);
            AdvanceResult result = conversationEngineDomainService.advance(lead, text, choiceId);
            ConversationStateEnum previous = lead.getConversationState();
            if (leadPersistenceApplicationService.persistConversationTurn(lead, channel, inboundLog, result, LocalDateTime.now())) {
                log.info("Inbound message handled. tenantId={}, leadId={}, channel={}, fromState={}, toState={}, interrupted={}",
                        lead.getTenantId(), lead.getId(), channel.getCode(),
                        previous == null ? null : previous.getCode(),
                        lead.getConversationState() == null ? null : lead.getConversationState().getCode(),
                        result.interrupted());
                return new InboundResult(routed.decision(), lead, result);
            }
            log.debug("Conversation turn version conflict, re-reading lead. leadId={}, attempt={}", lead.getId(), attempt);
            lead = leadRepository.findById(resolution.lead().getId());
            if (lead == null) {
                throw AppException.notFound("Lead not found: " + resolution.lead().getId());
            }
        }
        throw new AppException(ResponseCode.CONCURRENT_MODIFICATION.getCode(),
                "Lead was modified concurrently: " + resolution.lead().getId());
    }

    private void validate(InboundEnvelope envelope) {
        if (envelope == null) {
            throw AppException.illegalParameter("envelope 不能为空");
        }
        if (envelope.getChannel() != ChannelEnum.TELEGRAM && envelope.getChannel() != ChannelEnum.WHATSAPP) {
            throw AppException.illegalParameter("不支持的入站渠道: " + envelope.getChannel());
        }
        if (StringUtils.isBlank(envelope.getExternalUserId())) {
            throw AppException.illegalParameter("externalUserId 不能为空");
        }
    }

    /**
     * 渠道原生分享的联系人只在等待联系方式时作为选项提交，其它时候仅补全手机号
     */
    private String choiceOf(LeadEntity lead, InboundEnvelope envelope) {
        String choiceId = StringUtils.trimToNull(envelope.getStructuredChoiceId());
        if (choiceId != null || StringUtils.isBlank(envelope.getContactPhone())) {
            return choiceId;
        }
        if (lead.getPendingSlot() == ConversationSlotEnum.CONTACT
                || lead.getConversationState() == ConversationStateEnum.UNREACHABLE) {
            return ConversationInputDomainService.CHOICE_CONTACT_SHARED;
        }
        return null;
    }

    private String inboundLogText(String text, InboundEnvelope envelope) {
        if (text != null) {
            return text;
        }
        if (StringUtils.isNotBlank(envelope.getStructuredChoiceId())) {
            return "[choice] " + envelope.getStructuredChoiceId().trim();
        }
        if (StringUtils.isNotBlank(envelope.getContactPhone())) {
            return "[contact] " + envelope.getContactPhone().trim();
        }
        if (StringUtils.isNotBlank(envelope.getMediaRef())) {
            return "[media] " + envelope.getMediaRef().trim();
        }
        return "";
    }

    /**
     * 入站处理结果；未路由时 lead 与 advance 为空
     */
    public record InboundResult(RouteDecision decision, LeadEntity lead, AdvanceResult advance) {

        public static InboundResult notRouted() {
            return new InboundResult(RouteDecision.notRouted(), null, null);
        }
    }
}
