package com.leadengine.domain.conversation.model.valobj;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.ConversationSlotEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.PurposeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一次会话推进产生的线索字段变更，只包含显式设置过的字段。
 */
@Getter
public class LeadFieldUpdates {

    private boolean pendingSlotChanged;
    private ConversationSlotEnum pendingSlot;
    private final Set<ConversationSlotEnum> filledSlots = EnumSet.noneOf(ConversationSlotEnum.class);
    private LanguageEnum language;
    private PurposeEnum purpose;
    private TransactionTypeEnum transactionType;
    private PropertyTypeEnum propertyType;
    private boolean budgetChanged;
    private BigDecimal budgetMin;
    private BigDecimal budgetMax;
    private String phone;
    private final Map<String, Object> conversationData = new LinkedHashMap<>();

    public static LeadFieldUpdates none() {
        return new LeadFieldUpdates();
    }

    public LeadFieldUpdates pendingSlot(ConversationSlotEnum slot) {
        this.pendingSlotChanged = true;
        this.pendingSlot = slot;
        return this;
    }

    public LeadFieldUpdates filled(ConversationSlotEnum slot) {
        this.filledSlots.add(slot);
        return this;
    }

    public LeadFieldUpdates language(LanguageEnum language) {
        this.language = language;
        return this;
    }

    public LeadFieldUpdates purpose(PurposeEnum purpose) {
        this.purpose = purpose;
        return this;
    }

    public LeadFieldUpdates transactionType(TransactionTypeEnum transactionType) {
        this.transactionType = transactionType;
        return this;
    }

    public LeadFieldUpdates propertyType(PropertyTypeEnum propertyType) {
        this.propertyType = propertyType;
        return this;
    }

    public LeadFieldUpdates budget(BigDecimal min, BigDecimal max) {
        this.budgetChanged = true;
        this.budgetMin = min;
        this.budgetMax = max;
        return this;
    }

    public LeadFieldUpdates phone(String phone) {
        this.phone = phone;
        return this;
    }

    public LeadFieldUpdates data(String key, Object value) {
        this.conversationData.put(key, value);
        return this;
    }

    public Set<ConversationSlotEnum> getFilledSlots() {
        return Collections.unmodifiableSet(filledSlots);
    }

    public Map<String, Object> getConversationData() {
        return Collections.unmodifiableMap(conversationData);
    }

    public boolean isEmpty() {
        return !pendingSlotChanged && filledSlots.isEmpty() && language == null && purpose == null
                && transactionType == null && propertyType == null && !budgetChanged && phone == null
                && conversationData.isEmpty();
    }

    /**
     * 写回线索实体。手机号只在原值为空时写入。
     */
    public void applyTo(LeadEntity lead) {
        if (lead == null) {
            return;
        }
        if (pendingSlotChanged) {
            lead.setPendingSlot(pendingSlot);
        }
        for (ConversationSlotEnum slot : filledSlots) {
            lead.markSlotFilled(slot);
        }
        if (language != null) {
            lead.setLanguage(language);
        }
        if (purpose != null) {
            lead.setPurpose(purpose);
        }
        if (transactionType != null) {
            lead.setTransactionType(transactionType);
        }
        if (propertyType != null) {
            lead.setPropertyType(propertyType);
        }
        if (budgetChanged) {
            lead.setBudgetMin(budgetMin);
            lead.setBudgetMax(budgetMax);
        }
        if (phone != null && (lead.getPhone() == null || lead.getPhone().isBlank())) {
            lead.setPhone(phone);
        }
        if (!conversationData.isEmpty()) {
            Map<String, Object> merged = lead.getConversationData() == null
                    ? new HashMap<>()
                    : new HashMap<>(lead.getConversationData());
            merged.putAll(conversationData);
            lead.setConversationData(merged);
        }
    }
}
