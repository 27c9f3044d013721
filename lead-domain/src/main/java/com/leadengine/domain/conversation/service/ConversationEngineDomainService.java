package com.leadengine.domain.conversation.service;

import com.leadengine.domain.conversation.adapter.gateway.IKnowledgeResponder;
import com.leadengine.domain.conversation.model.valobj.AdvanceResult;
import com.leadengine.domain.conversation.model.valobj.BudgetBracket;
import com.leadengine.domain.conversation.model.valobj.LeadFieldUpdates;
import com.leadengine.domain.conversation.model.valobj.OutboundRequest;
import com.leadengine.domain.conversation.model.valobj.ReplyOption;
import com.leadengine.domain.conversation.model.valobj.SlotInput;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ConversationSlotEnum;
import com.leadengine.types.enums.ConversationStateEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.PurposeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话引擎：每次处理一条入站输入，推进线索在资质漏斗中的位置。
 * <p>
 * 漏斗：语言 -> 目标 -> 联系方式 -> 预算 -> 物业类型 -> 交易类型 -> 价值展示 -> 联系方式闸口 -> 预约 -> 完成。
 * 输入与当前待填槽位不匹配时按插话处理：调用问答能力回答后重复同一提问，待填槽位与已填槽位不变。
 * 引擎只依赖入参与线索当前字段，不持有跨调用的状态，副作用只以请求形式返回。
 * </p>
 */
@Slf4j
@Service
public class ConversationEngineDomainService {

    public static final String REPORT_KIND_ROI = "roi";
    public static final String DATA_CONTACT_SKIPPED = "contactSkipped";
    public static final String DATA_PREFERRED_CALL_TIME = "preferredCallTime";

    private static final List<ConversationSlotEnum> QUALIFICATION_SLOTS = List.of(
            ConversationSlotEnum.BUDGET,
            ConversationSlotEnum.PROPERTY_TYPE,
            ConversationSlotEnum.TRANSACTION_TYPE);

    private static final String PARAGRAPH = "\n\n";

    private final ConversationInputDomainService inputDomainService;
    private final ConversationMessageCatalog messageCatalog;
    private final IKnowledgeResponder knowledgeResponder;

    public ConversationEngineDomainService(ConversationInputDomainService inputDomainService,
                                           ConversationMessageCatalog messageCatalog,
                                           IKnowledgeResponder knowledgeResponder) {
        this.inputDomainService = inputDomainService;
        this.messageCatalog = messageCatalog;
        this.knowledgeResponder = knowledgeResponder;
    }

    public AdvanceResult advance(LeadEntity lead, String freeText, String structuredChoiceId) {
        if (lead == null) {
            throw new IllegalArgumentException("lead cannot be null");
        }
        ConversationStateEnum state = lead.getConversationState() == null
                ? ConversationStateEnum.START
                : lead.getConversationState();
        LanguageEnum language = languageOf(lead);
        if (state == ConversationStateEnum.START) {
            return moveTo(lead, ConversationStateEnum.LANGUAGE_SELECT, ConversationSlotEnum.LANGUAGE,
                    language, LeadFieldUpdates.none(), null, new ArrayList<>());
        }
        if (state == ConversationStateEnum.COMPLETED) {
            return afterCompletion(lead, freeText, language);
        }
        if (state == ConversationStateEnum.UNREACHABLE) {
            return whileUnreachable(lead, freeText, structuredChoiceId, language);
        }

        ConversationSlotEnum pending = lead.getPendingSlot() != null ? lead.getPendingSlot() : defaultSlot(state, lead);
        SlotInput input = inputDomainService.parse(pending, freeText, structuredChoiceId);
        switch (input.kind()) {
            case MATCH:
                return accept(lead, state, pending, input.value(), language);
            case INVALID:
                log.debug("Invalid choice for pending slot. leadId={}, slot={}, choice={}",
                        lead.getId(), pending, structuredChoiceId);
                return reprompt(lead, state, pending, language, null, false);
            default:
                if (StringUtils.isBlank(freeText)) {
                    return reprompt(lead, state, pending, language, null, false);
                }
                return reprompt(lead, state, pending, language, answer(freeText, language, lead), true);
        }
    }

    private AdvanceResult accept(LeadEntity lead,
                                 ConversationStateEnum state,
                                 ConversationSlotEnum slot,
                                 String value,
                                 LanguageEnum language) {
        LeadFieldUpdates updates = new LeadFieldUpdates();
        List<OutboundRequest> sideEffects = new ArrayList<>();
        switch (slot) {
            case LANGUAGE: {
                LanguageEnum chosen = LanguageEnum.fromCode(value);
                updates.language(chosen).filled(ConversationSlotEnum.LANGUAGE);
                return moveTo(lead, ConversationStateEnum.WARMUP, ConversationSlotEnum.GOAL,
                        chosen, updates, null, sideEffects);
            }
            case GOAL: {
                PurposeEnum purpose = PurposeEnum.fromCode(value);
                updates.purpose(purpose).filled(ConversationSlotEnum.GOAL);
                if (purpose == PurposeEnum.INVESTMENT) {
                    updates.transactionType(TransactionTypeEnum.BUY).filled(ConversationSlotEnum.TRANSACTION_TYPE);
                }
                if (StringUtils.isNotBlank(lead.getPhone())) {
                    updates.filled(ConversationSlotEnum.CONTACT);
                    return nextQualification(lead, updates, language, sideEffects);
                }
                return moveTo(lead, ConversationStateEnum.CAPTURE_CONTACT, ConversationSlotEnum.CONTACT,
                        language, updates, null, sideEffects);
            }
            case CONTACT:
                return acceptContact(lead, state, value, language, updates, sideEffects);
            case BUDGET: {
                BudgetBracket bracket = BudgetBracket.ofIndex(Integer.parseInt(value));
                updates.budget(bracket.getMin(), bracket.getMax()).filled(ConversationSlotEnum.BUDGET);
                return nextQualification(lead, updates, language, sideEffects);
            }
            case PROPERTY_TYPE:
                updates.propertyType(PropertyTypeEnum.fromCode(value)).filled(ConversationSlotEnum.PROPERTY_TYPE);
                return nextQualification(lead, updates, language, sideEffects);
            case TRANSACTION_TYPE:
                updates.transactionType(TransactionTypeEnum.fromCode(value)).filled(ConversationSlotEnum.TRANSACTION_TYPE);
                return nextQualification(lead, updates, language, sideEffects);
            case REPORT:
                updates.filled(ConversationSlotEnum.REPORT);
                if ("yes".equals(value)) {
                    return contactGate(lead, updates, language, sideEffects);
                }
                return moveTo(lead, ConversationStateEnum.SCHEDULING, ConversationSlotEnum.SCHEDULE,
                        language, updates, null, sideEffects);
            case SCHEDULE:
                return complete(lead, value, language, updates, sideEffects);
            default:
                return reprompt(lead, state, slot, language, null, false);
        }
    }

    private AdvanceResult acceptContact(LeadEntity lead,
                                        ConversationStateEnum state,
                                        String value,
                                        LanguageEnum language,
                                        LeadFieldUpdates updates,
                                        List<OutboundRequest> sideEffects) {
        boolean shared = ConversationInputDomainService.CHOICE_CONTACT_SHARED.equals(value);
        boolean skipped = ConversationInputDomainService.CHOICE_CONTACT_SKIP.equals(value);
        if (state == ConversationStateEnum.HARD_GATE) {
            if (skipped || (shared && StringUtils.isBlank(lead.getPhone()))) {
                return reprompt(lead, state, ConversationSlotEnum.CONTACT, language, null, false);
            }
            if (!shared) {
                updates.phone(value);
            }
            updates.filled(ConversationSlotEnum.CONTACT);
            return deliverReport(lead, updates, language, sideEffects);
        }
        if (skipped) {
            updates.data(DATA_CONTACT_SKIPPED, Boolean.TRUE);
            return nextQualification(lead, updates, language, sideEffects);
        }
        if (shared && StringUtils.isBlank(lead.getPhone())) {
            return reprompt(lead, state, ConversationSlotEnum.CONTACT, language, null, false);
        }
        String phone = shared ? lead.getPhone() : value;
        if (!shared) {
            updates.phone(phone);
        }
        updates.filled(ConversationSlotEnum.CONTACT);
        sideEffects.add(new OutboundRequest.NotifyOperator(messageCatalog.operatorText(
                "operator.new_contact", displayName(lead), phone, String.valueOf(lead.getId()))));
        return nextQualification(lead, updates, language, sideEffects);
    }

    private AdvanceResult nextQualification(LeadEntity lead,
                                            LeadFieldUpdates updates,
                                            LanguageEnum language,
                                            List<OutboundRequest> sideEffects) {
        LeadEntity view = preview(lead, updates);
        for (ConversationSlotEnum slot : QUALIFICATION_SLOTS) {
            if (!view.isSlotFilled(slot)) {
                return moveTo(lead, ConversationStateEnum.SLOT_FILLING, slot, language, updates, null, sideEffects);
            }
        }
        return moveTo(lead, ConversationStateEnum.VALUE_PROPOSITION, ConversationSlotEnum.REPORT,
                language, updates, null, sideEffects);
    }

    private AdvanceResult contactGate(LeadEntity lead,
                                      LeadFieldUpdates updates,
                                      LanguageEnum language,
                                      List<OutboundRequest> sideEffects) {
        LeadEntity view = preview(lead, updates);
        if (StringUtils.isNotBlank(view.getPhone())) {
            return deliverReport(lead, updates, language, sideEffects);
        }
        if (view.hasReachableChannel()) {
            return moveTo(lead, ConversationStateEnum.HARD_GATE, ConversationSlotEnum.CONTACT,
                    language, updates, null, sideEffects);
        }
        updates.pendingSlot(null);
        sideEffects.add(new OutboundRequest.NotifyOperator(messageCatalog.operatorText(
                "operator.unreachable", displayName(lead), String.valueOf(lead.getId()))));
        return new AdvanceResult(messageCatalog.text("reply.unreachable", language),
                ConversationStateEnum.UNREACHABLE, updates, List.of(), sideEffects, false);
    }

    private AdvanceResult deliverReport(LeadEntity lead,
                                        LeadFieldUpdates updates,
                                        LanguageEnum language,
                                        List<OutboundRequest> sideEffects) {
        LeadEntity view = preview(lead, updates);
        sideEffects.add(new OutboundRequest.GenerateReport(REPORT_KIND_ROI, reportParams(view, language)));
        return moveTo(lead, ConversationStateEnum.SCHEDULING, ConversationSlotEnum.SCHEDULE, language, updates,
                messageCatalog.text("reply.report_on_way", language), sideEffects);
    }

    private AdvanceResult complete(LeadEntity lead,
                                   String callTime,
                                   LanguageEnum language,
                                   LeadFieldUpdates updates,
                                   List<OutboundRequest> sideEffects) {
        updates.filled(ConversationSlotEnum.SCHEDULE).pendingSlot(null);
        if ("none".equals(callTime)) {
            return new AdvanceResult(messageCatalog.text("reply.completed_no_call", language),
                    ConversationStateEnum.COMPLETED, updates, List.of(), sideEffects, false);
        }
        updates.data(DATA_PREFERRED_CALL_TIME, callTime);
        LeadEntity view = preview(lead, updates);
        sideEffects.add(new OutboundRequest.NotifyOperator(messageCatalog.operatorText(
                "operator.callback", displayName(lead), StringUtils.defaultIfBlank(view.getPhone(), "-"),
                callTime, summary(view, LanguageEnum.EN))));
        return new AdvanceResult(messageCatalog.text("reply.completed", language,
                messageCatalog.text("option.schedule." + callTime, language)),
                ConversationStateEnum.COMPLETED, updates, List.of(), sideEffects, false);
    }

    private AdvanceResult afterCompletion(LeadEntity lead, String freeText, LanguageEnum language) {
        String reply = StringUtils.isBlank(freeText)
                ? messageCatalog.text("reply.terminal", language)
                : answer(freeText, language, lead);
        return new AdvanceResult(reply, ConversationStateEnum.COMPLETED, LeadFieldUpdates.none(),
                List.of(), List.of(), StringUtils.isNotBlank(freeText));
    }

    /**
     * 无可触达渠道时停留在 UNREACHABLE，一旦拿到手机号即恢复到报告发送
     */
    private AdvanceResult whileUnreachable(LeadEntity lead, String freeText, String choiceId, LanguageEnum language) {
        SlotInput input = inputDomainService.parse(ConversationSlotEnum.CONTACT, freeText, choiceId);
        boolean hasPhone = StringUtils.isNotBlank(lead.getPhone());
        if (input.isMatch() && !ConversationInputDomainService.CHOICE_CONTACT_SKIP.equals(input.value())
                && (hasPhone || !ConversationInputDomainService.CHOICE_CONTACT_SHARED.equals(input.value()))) {
            LeadFieldUpdates updates = new LeadFieldUpdates();
            if (!ConversationInputDomainService.CHOICE_CONTACT_SHARED.equals(input.value())) {
                updates.phone(input.value());
            }
            updates.filled(ConversationSlotEnum.CONTACT);
            return deliverReport(lead, updates, language, new ArrayList<>());
        }
        return new AdvanceResult(messageCatalog.text("reply.unreachable", language),
                ConversationStateEnum.UNREACHABLE, LeadFieldUpdates.none(), List.of(), List.of(), false);
    }

    private AdvanceResult moveTo(LeadEntity lead,
                                 ConversationStateEnum nextState,
                                 ConversationSlotEnum nextSlot,
                                 LanguageEnum language,
                                 LeadFieldUpdates updates,
                                 String preface,
                                 List<OutboundRequest> sideEffects) {
        updates.pendingSlot(nextSlot);
        Prompt prompt = promptFor(preview(lead, updates), nextState, nextSlot, language);
        List<OutboundRequest> effects = new ArrayList<>(sideEffects);
        effects.addAll(prompt.sideEffects());
        String reply = preface == null ? prompt.text() : preface + PARAGRAPH + prompt.text();
        return new AdvanceResult(reply, nextState, updates, prompt.options(), effects, false);
    }

    private AdvanceResult reprompt(LeadEntity lead,
                                   ConversationStateEnum state,
                                   ConversationSlotEnum slot,
                                   LanguageEnum language,
                                   String answer,
                                   boolean interrupted) {
        Prompt prompt = promptFor(lead, state, slot, language);
        String reply = answer == null ? prompt.text() : answer + PARAGRAPH + prompt.text();
        return new AdvanceResult(reply, state, LeadFieldUpdates.none(), prompt.options(),
                prompt.sideEffects(), interrupted);
    }

    private Prompt promptFor(LeadEntity lead, ConversationStateEnum state, ConversationSlotEnum slot, LanguageEnum language) {
        switch (slot) {
            case LANGUAGE:
                return new Prompt(messageCatalog.text("prompt.language", language), List.of(
                        new ReplyOption("lang_en", "English"),
                        new ReplyOption("lang_fa", "فارسی"),
                        new ReplyOption("lang_ar", "العربية"),
                        new ReplyOption("lang_ru", "Русский")), List.of());
            case GOAL:
                return new Prompt(messageCatalog.text("prompt.goal", language),
                        options("goal_", "option.goal.", language, PurposeEnum.values()), List.of());
            case CONTACT:
                List<OutboundRequest> share = lead.hasReachableChannel()
                        ? List.of(new OutboundRequest.RequestContactShare(messageCatalog.text("prompt.contact_share", language)))
                        : List.of();
                if (state == ConversationStateEnum.HARD_GATE) {
                    return new Prompt(messageCatalog.text("prompt.contact_gate", language), List.of(), share);
                }
                return new Prompt(messageCatalog.text("prompt.contact", language),
                        List.of(new ReplyOption(ConversationInputDomainService.CHOICE_CONTACT_SKIP,
                                messageCatalog.text("option.contact.skip", language))), share);
            case BUDGET: {
                List<ReplyOption> options = new ArrayList<>();
                for (BudgetBracket bracket : BudgetBracket.values()) {
                    options.add(new ReplyOption("budget_" + bracket.getIndex(),
                            messageCatalog.text("option.budget." + bracket.getIndex(), language)));
                }
                return new Prompt(messageCatalog.text("prompt.budget", language), options, List.of());
            }
            case PROPERTY_TYPE:
                return new Prompt(messageCatalog.text("prompt.property_type", language),
                        options("prop_", "option.property.", language, PropertyTypeEnum.values()), List.of());
            case TRANSACTION_TYPE:
                return new Prompt(messageCatalog.text("prompt.transaction_type", language),
                        options("tx_", "option.transaction.", language, TransactionTypeEnum.values()), List.of());
            case REPORT:
                return new Prompt(messageCatalog.text("prompt.value_proposition", language, summary(lead, language)),
                        List.of(new ReplyOption("report_yes", messageCatalog.text("option.report.yes", language)),
                                new ReplyOption("report_no", messageCatalog.text("option.report.no", language))),
                        List.of());
            case SCHEDULE: {
                List<ReplyOption> options = new ArrayList<>();
                for (String code : List.of("morning", "afternoon", "evening", "none")) {
                    options.add(new ReplyOption("schedule_" + code, messageCatalog.text("option.schedule." + code, language)));
                }
                return new Prompt(messageCatalog.text("prompt.schedule", language), options, List.of());
            }
            default:
                throw new IllegalStateException("No prompt for slot: " + slot);
        }
    }

    private <E extends Enum<E>> List<ReplyOption> options(String idPrefix, String labelPrefix,
                                                          LanguageEnum language, E[] values) {
        List<ReplyOption> options = new ArrayList<>();
        for (E value : values) {
            String code = value.name().toLowerCase();
            options.add(new ReplyOption(idPrefix + code, messageCatalog.text(labelPrefix + code, language)));
        }
        return options;
    }

    private ConversationSlotEnum defaultSlot(ConversationStateEnum state, LeadEntity lead) {
        switch (state) {
            case LANGUAGE_SELECT:
                return ConversationSlotEnum.LANGUAGE;
            case WARMUP:
                return ConversationSlotEnum.GOAL;
            case CAPTURE_CONTACT:
            case HARD_GATE:
                return ConversationSlotEnum.CONTACT;
            case SLOT_FILLING:
                for (ConversationSlotEnum slot : QUALIFICATION_SLOTS) {
                    if (!lead.isSlotFilled(slot)) {
                        return slot;
                    }
                }
                return ConversationSlotEnum.BUDGET;
            case VALUE_PROPOSITION:
                return ConversationSlotEnum.REPORT;
            case SCHEDULING:
                return ConversationSlotEnum.SCHEDULE;
            default:
                throw new IllegalStateException("No pending slot for state: " + state);
        }
    }

    private String answer(String question, LanguageEnum language, LeadEntity lead) {
        String answer = null;
        try {
            answer = knowledgeResponder.answer(question, language, lead);
        } catch (RuntimeException ex) {
            log.warn("Knowledge responder failed, using fallback answer. leadId={}, error={}",
                    lead.getId(), ex.getMessage());
        }
        return StringUtils.isBlank(answer) ? messageCatalog.text("answer.fallback", language) : answer.trim();
    }

    private String summary(LeadEntity lead, LanguageEnum language) {
        String budget = budgetLabel(lead, language);
        String propertyType = lead.getPropertyType() == null
                ? "-"
                : messageCatalog.text("option.property." + lead.getPropertyType().getCode(), language);
        String transaction = lead.getTransactionType() == null
                ? "-"
                : messageCatalog.text("option.transaction." + lead.getTransactionType().getCode(), language);
        return messageCatalog.text("summary.criteria", language, budget, propertyType, transaction);
    }

    private String budgetLabel(LeadEntity lead, LanguageEnum language) {
        if (lead.getBudgetMin() == null && lead.getBudgetMax() == null) {
            return "-";
        }
        for (BudgetBracket bracket : BudgetBracket.values()) {
            if (sameAmount(bracket.getMin(), lead.getBudgetMin()) && sameAmount(bracket.getMax(), lead.getBudgetMax())) {
                return messageCatalog.text("option.budget." + bracket.getIndex(), language);
            }
        }
        return plain(lead.getBudgetMin()) + " - " + plain(lead.getBudgetMax());
    }

    private boolean sameAmount(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }

    private String plain(BigDecimal amount) {
        return amount == null ? "" : amount.stripTrailingZeros().toPlainString();
    }

    private Map<String, Object> reportParams(LeadEntity view, LanguageEnum language) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("leadId", view.getId());
        params.put("language", language.getCode());
        putIfPresent(params, "budgetMin", view.getBudgetMin() == null ? null : view.getBudgetMin().toPlainString());
        putIfPresent(params, "budgetMax", view.getBudgetMax() == null ? null : view.getBudgetMax().toPlainString());
        putIfPresent(params, "propertyType", view.getPropertyType() == null ? null : view.getPropertyType().getCode());
        putIfPresent(params, "transactionType", view.getTransactionType() == null ? null : view.getTransactionType().getCode());
        putIfPresent(params, "purpose", view.getPurpose() == null ? null : view.getPurpose().getCode());
        return params;
    }

    private void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }

    /**
     * 线索当前字段叠加本次变更后的只读视图
     */
    private LeadEntity preview(LeadEntity lead, LeadFieldUpdates updates) {
        LeadEntity view = new LeadEntity();
        view.setId(lead.getId());
        view.setTenantId(lead.getTenantId());
        view.setName(lead.getName());
        view.setPhone(lead.getPhone());
        view.setTelegramUserId(lead.getTelegramUserId());
        view.setWhatsappUserId(lead.getWhatsappUserId());
        view.setProfileUrl(lead.getProfileUrl());
        view.setLanguage(lead.getLanguage());
        view.setPurpose(lead.getPurpose());
        view.setTransactionType(lead.getTransactionType());
        view.setPropertyType(lead.getPropertyType());
        view.setBudgetMin(lead.getBudgetMin());
        view.setBudgetMax(lead.getBudgetMax());
        view.setFilledSlots(lead.getFilledSlots() == null ? new HashMap<>() : new HashMap<>(lead.getFilledSlots()));
        view.setConversationData(lead.getConversationData() == null ? new HashMap<>() : new HashMap<>(lead.getConversationData()));
        updates.applyTo(view);
        return view;
    }

    private LanguageEnum languageOf(LeadEntity lead) {
        return lead.getLanguage() == null ? LanguageEnum.EN : lead.getLanguage();
    }

    private String displayName(LeadEntity lead) {
        return StringUtils.defaultIfBlank(lead.getName(), "-");
    }

    private record Prompt(String text, List<ReplyOption> options, List<OutboundRequest> sideEffects) {
    }
}
