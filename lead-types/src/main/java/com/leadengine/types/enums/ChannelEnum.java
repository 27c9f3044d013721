package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 交互渠道枚举
 */
public enum ChannelEnum {

    TELEGRAM("telegram"),
    WHATSAPP("whatsapp"),
    LINKEDIN("linkedin"),
    EMAIL("email"),
    PHONE("phone");

    private final String code;

    ChannelEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ChannelEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (ChannelEnum value : ChannelEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown channel code: " + code);
    }
}
