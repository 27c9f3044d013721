package com.leadengine.trigger.application.common;

import com.leadengine.api.dto.CampaignDTO;
import com.leadengine.api.dto.LeadDTO;
import com.leadengine.api.dto.OutboundRequestDTO;
import com.leadengine.api.dto.ReplyOptionDTO;
import com.leadengine.domain.conversation.model.valobj.OutboundRequest;
import com.leadengine.domain.conversation.model.valobj.ReplyOption;
import com.leadengine.domain.followup.model.entity.FollowupCampaignEntity;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;

/**
 * 线索/活动/出站请求视图组装器：统一领域对象到 DTO 的映射，枚举一律输出编码。
 */
@Component
public class LeadViewAssembler {

    public LeadDTO toLeadDTO(LeadEntity lead) {
        if (lead == null) {
            return null;
        }
        LeadDTO dto = new LeadDTO();
        dto.setId(lead.getId());
        dto.setTenantId(lead.getTenantId());
        dto.setName(lead.getName());
        dto.setEmail(lead.getEmail());
        dto.setJobTitle(lead.getJobTitle());
        dto.setCompany(lead.getCompany());
        dto.setProfileUrl(lead.getProfileUrl());
        dto.setTelegramUserId(lead.getTelegramUserId());
        dto.setWhatsappUserId(lead.getWhatsappUserId());
        dto.setPhone(lead.getPhone());
        dto.setSource(lead.getSource() == null ? null : lead.getSource().getCode());
        dto.setStatus(lead.getStatus() == null ? null : lead.getStatus().getCode());
        dto.setTransactionType(lead.getTransactionType() == null ? null : lead.getTransactionType().getCode());
        dto.setPropertyType(lead.getPropertyType() == null ? null : lead.getPropertyType().getCode());
        dto.setBudgetMin(lead.getBudgetMin());
        dto.setBudgetMax(lead.getBudgetMax());
        dto.setPreferredLocations(lead.getPreferredLocations() == null
                ? new LinkedHashSet<>() : new LinkedHashSet<>(lead.getPreferredLocations()));
        dto.setPurpose(lead.getPurpose() == null ? null : lead.getPurpose().getCode());
        dto.setConversationState(lead.getConversationState() == null ? null : lead.getConversationState().getCode());
        dto.setLanguage(lead.getLanguage() == null ? null : lead.getLanguage().getCode());
        dto.setMessagesSent(lead.getMessagesSent());
        dto.setMessagesReceived(lead.getMessagesReceived());
        dto.setLastActiveAt(lead.getLastActiveAt());
        dto.setLastContactedAt(lead.getLastContactedAt());
        dto.setNextFollowupAt(lead.getNextFollowupAt());
        dto.setFollowupCount(lead.getFollowupCount());
        dto.setScore(lead.getScore());
        dto.setGrade(lead.getGrade() == null ? null : lead.getGrade().getCode());
        dto.setCreatedAt(lead.getCreatedAt());
        dto.setUpdatedAt(lead.getUpdatedAt());
        return dto;
    }

    public CampaignDTO toCampaignDTO(FollowupCampaignEntity campaign) {
        if (campaign == null) {
            return null;
        }
        CampaignDTO dto = new CampaignDTO();
        dto.setId(campaign.getId());
        dto.setTenantId(campaign.getTenantId());
        dto.setName(campaign.getName());
        dto.setTargetStatuses(codes(campaign.getTargetStatuses(), LeadStatusEnum::getCode));
        dto.setMinScore(campaign.getMinScore());
        dto.setMaxScore(campaign.getMaxScore());
        dto.setTargetSources(codes(campaign.getTargetSources(), LeadSourceEnum::getCode));
        dto.setMessageTemplate(campaign.getMessageTemplate());
        dto.setChannels(codes(campaign.getChannels(), ChannelEnum::getCode));
        dto.setStatus(campaign.getStatus() == null ? null : campaign.getStatus().getCode());
        dto.setScheduledAt(campaign.getScheduledAt());
        dto.setExecutedAt(campaign.getExecutedAt());
        dto.setTotalTargeted(campaign.getTotalTargeted());
        dto.setTotalSent(campaign.getTotalSent());
        dto.setTotalFailed(campaign.getTotalFailed());
        dto.setCreatedAt(campaign.getCreatedAt());
        return dto;
    }

    public List<OutboundRequestDTO> toOutboundDTOs(Collection<OutboundRequest> requests) {
        List<OutboundRequestDTO> dtos = new ArrayList<>();
        if (requests == null) {
            return dtos;
        }
        for (OutboundRequest request : requests) {
            dtos.add(toOutboundDTO(request));
        }
        return dtos;
    }

    public OutboundRequestDTO toOutboundDTO(OutboundRequest request) {
        OutboundRequestDTO dto = new OutboundRequestDTO();
        if (request instanceof OutboundRequest.SendText sendText) {
            dto.setType("send_text");
            dto.setText(sendText.text());
        } else if (request instanceof OutboundRequest.SendButtons buttons) {
            dto.setType("send_buttons");
            dto.setText(buttons.text());
            dto.setOptions(toOptionDTOs(buttons.options()));
        } else if (request instanceof OutboundRequest.SendList list) {
            dto.setType("send_list");
            dto.setText(list.text());
            dto.setOptions(toOptionDTOs(list.options()));
        } else if (request instanceof OutboundRequest.RequestContactShare share) {
            dto.setType("request_contact_share");
            dto.setText(share.prompt());
        } else if (request instanceof OutboundRequest.GenerateReport report) {
            dto.setType("generate_report");
            dto.setReportKind(report.kind());
            dto.setReportParams(report.params());
        } else if (request instanceof OutboundRequest.NotifyOperator notify) {
            dto.setType("notify_operator");
            dto.setText(notify.message());
        }
        return dto;
    }

    private List<ReplyOptionDTO> toOptionDTOs(List<ReplyOption> options) {
        List<ReplyOptionDTO> dtos = new ArrayList<>();
        for (ReplyOption option : options) {
            dtos.add(new ReplyOptionDTO(option.id(), option.label()));
        }
        return dtos;
    }

    private <E> List<String> codes(List<E> values, Function<E, String> code) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (E value : values) {
            if (value != null) {
                result.add(code.apply(value));
            }
        }
        return result;
    }
}
