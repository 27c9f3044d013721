package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 交互方向枚举
 */
public enum InteractionDirectionEnum {

    /** 线索发来的消息 */
    INBOUND("inbound"),
    /** 发送给线索的消息 */
    OUTBOUND("outbound");

    private final String code;

    InteractionDirectionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static InteractionDirectionEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (InteractionDirectionEnum value : InteractionDirectionEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown interaction direction code: " + code);
    }
}
