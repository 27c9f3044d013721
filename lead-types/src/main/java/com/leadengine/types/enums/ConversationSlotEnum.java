package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 会话槽位枚举
 */
public enum ConversationSlotEnum {

    LANGUAGE("language"),
    GOAL("goal"),
    CONTACT("contact"),
    BUDGET("budget"),
    PROPERTY_TYPE("property_type"),
    TRANSACTION_TYPE("transaction_type"),
    REPORT("report"),
    SCHEDULE("schedule");

    private final String code;

    ConversationSlotEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ConversationSlotEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (ConversationSlotEnum value : ConversationSlotEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown conversation slot code: " + code);
    }
}
