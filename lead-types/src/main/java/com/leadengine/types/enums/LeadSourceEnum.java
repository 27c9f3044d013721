package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 线索来源枚举
 */
public enum LeadSourceEnum {

    LINKEDIN("linkedin"),
    TELEGRAM("telegram"),
    WHATSAPP("whatsapp"),
    MANUAL("manual"),
    REFERRAL("referral");

    private final String code;

    LeadSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LeadSourceEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (LeadSourceEnum value : LeadSourceEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lead source code: " + code);
    }
}
