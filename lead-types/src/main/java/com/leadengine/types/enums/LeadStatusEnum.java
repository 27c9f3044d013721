package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 线索状态枚举
 */
public enum LeadStatusEnum {

    /** 跟进中 - 可进入自动跟进流程 */
    OPEN("open"),
    /** 已成交 */
    WON("won"),
    /** 已流失 */
    LOST("lost"),
    /** 培育中 - 人工维护，不再自动触达 */
    NURTURING("nurturing");

    private final String code;

    LeadStatusEnum(String code) {
        this.code = code;
    }

    /**
     * 已成交或已流失的线索不再参与匹配与跟进。
     */
    public boolean isClosed() {
        return this == WON || this == LOST;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LeadStatusEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (LeadStatusEnum value : LeadStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lead status code: " + code);
    }
}
