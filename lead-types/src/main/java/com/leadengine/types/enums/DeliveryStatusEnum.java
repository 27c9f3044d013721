package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 交互投递状态枚举
 */
public enum DeliveryStatusEnum {

    /** 入站消息已接收 */
    RECEIVED("received"),
    /** 出站消息已投递 */
    DELIVERED("delivered"),
    /** 出站消息投递失败 */
    FAILED("failed");

    private final String code;

    DeliveryStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DeliveryStatusEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (DeliveryStatusEnum value : DeliveryStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown delivery status code: " + code);
    }
}
