package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 业务线枚举，用于共享渠道入口的会话路由
 */
public enum VerticalEnum {

    REALTY("realty"),
    EXPO("expo"),
    SUPPORT("support");

    private final String code;

    VerticalEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static VerticalEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (VerticalEnum value : VerticalEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown vertical code: " + code);
    }
}
