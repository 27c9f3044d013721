package com.leadengine.domain.lead.service;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.domain.lead.model.valobj.ObservedLeadFields;
import com.leadengine.types.enums.ChannelEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.LeadSourceEnum;
import com.leadengine.types.enums.LeadStatusEnum;
import com.leadengine.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 线索身份领域服务：入参校验、规范化、新建与空字段补全。
 * <p>
 * 补全只写入已有记录上为空的字段，已填写的字段不会被覆盖，因此重复补全是幂等的。
 * </p>
 */
@Service
public class LeadIdentityDomainService {

    /**
     * 规范化并校验观测字段，缺少租户或身份键时拒绝
     */
    public ObservedLeadFields normalize(Long tenantId, ObservedLeadFields observed) {
        if (tenantId == null) {
            throw AppException.illegalParameter("tenantId 不能为空");
        }
        if (observed == null) {
            throw AppException.illegalParameter("observed fields 不能为空");
        }
        ObservedLeadFields normalized = ObservedLeadFields.builder()
                .channel(observed.getChannel())
                .channelUserId(StringUtils.trimToNull(observed.getChannelUserId()))
                .profileUrl(normalizeProfileUrl(observed.getProfileUrl()))
                .phone(normalizePhone(observed.getPhone()))
                .name(StringUtils.trimToNull(observed.getName()))
                .email(StringUtils.lowerCase(StringUtils.trimToNull(observed.getEmail())))
                .jobTitle(StringUtils.trimToNull(observed.getJobTitle()))
                .company(StringUtils.trimToNull(observed.getCompany()))
                .source(observed.getSource())
                .language(observed.getLanguage())
                .build();
        if (normalized.getChannelUserId() != null && !isMessagingChannel(normalized.getChannel())) {
            throw AppException.illegalParameter("channelUserId 需要 telegram 或 whatsapp 渠道: " + normalized.getChannel());
        }
        if (normalized.getProfileUrl() == null && normalized.getChannelUserId() == null && normalized.getPhone() == null) {
            throw AppException.illegalParameter("至少需要一个身份键: profileUrl / channelUserId / phone");
        }
        return normalized;
    }

    public LeadEntity newLead(Long tenantId, ObservedLeadFields observed, LocalDateTime now) {
        LeadEntity lead = new LeadEntity();
        lead.setTenantId(tenantId);
        lead.setStatus(LeadStatusEnum.OPEN);
        lead.setConversationState(ConversationStateEnum.START);
        lead.setSource(observed.getSource() != null ? observed.getSource() : sourceOf(observed));
        lead.setCreatedAt(now);
        lead.setUpdatedAt(now);
        mergeInto(lead, observed);
        return lead;
    }

    /**
     * 将观测字段补全到已有线索上，仅覆盖空字段
     *
     * @return 是否有字段被写入
     */
    public boolean mergeInto(LeadEntity lead, ObservedLeadFields observed) {
        if (lead == null || observed == null) {
            return false;
        }
        boolean changed = false;
        if (observed.getChannel() == ChannelEnum.TELEGRAM) {
            changed |= fill(lead::getTelegramUserId, lead::setTelegramUserId, observed.getChannelUserId());
        } else if (observed.getChannel() == ChannelEnum.WHATSAPP) {
            changed |= fill(lead::getWhatsappUserId, lead::setWhatsappUserId, observed.getChannelUserId());
        }
        changed |= fill(lead::getProfileUrl, lead::setProfileUrl, observed.getProfileUrl());
        changed |= fill(lead::getPhone, lead::setPhone, observed.getPhone());
        changed |= fill(lead::getName, lead::setName, observed.getName());
        changed |= fill(lead::getEmail, lead::setEmail, observed.getEmail());
        changed |= fill(lead::getJobTitle, lead::setJobTitle, observed.getJobTitle());
        changed |= fill(lead::getCompany, lead::setCompany, observed.getCompany());
        if (lead.getLanguage() == null && observed.getLanguage() != null) {
            lead.setLanguage(observed.getLanguage());
            changed = true;
        }
        return changed;
    }

    /**
     * 手机号规范化：去除空白与分隔符，保留开头的 +，不足 7 位数字视为无效
     */
    public String normalizePhone(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String trimmed = raw.trim();
        StringBuilder digits = new StringBuilder();
        for (char c : trimmed.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(Character.forDigit(Character.digit(c, 10), 10));
            }
        }
        if (digits.length() < 7 || digits.length() > 15) {
            return null;
        }
        if (trimmed.startsWith("+") || trimmed.startsWith("00")) {
            String number = trimmed.startsWith("00") ? digits.substring(2) : digits.toString();
            return "+" + number;
        }
        return digits.toString();
    }

    private String normalizeProfileUrl(String raw) {
        String url = StringUtils.trimToNull(raw);
        if (url == null) {
            return null;
        }
        url = StringUtils.removeEnd(url, "/");
        return url.toLowerCase();
    }

    private boolean isMessagingChannel(ChannelEnum channel) {
        return channel == ChannelEnum.TELEGRAM || channel == ChannelEnum.WHATSAPP;
    }

    private LeadSourceEnum sourceOf(ObservedLeadFields observed) {
        if (observed.getChannel() == ChannelEnum.TELEGRAM) {
            return LeadSourceEnum.TELEGRAM;
        }
        if (observed.getChannel() == ChannelEnum.WHATSAPP) {
            return LeadSourceEnum.WHATSAPP;
        }
        if (observed.getProfileUrl() != null) {
            return LeadSourceEnum.LINKEDIN;
        }
        return LeadSourceEnum.MANUAL;
    }

    private boolean fill(Supplier<String> getter, Consumer<String> setter, String incoming) {
        if (StringUtils.isBlank(incoming) || StringUtils.isNotBlank(getter.get())) {
            return false;
        }
        setter.accept(incoming);
        return true;
    }
}
