package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 购房目的枚举
 */
public enum PurposeEnum {

    INVESTMENT("investment"),
    LIVING("living"),
    RESIDENCY("residency");

    private final String code;

    PurposeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PurposeEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (PurposeEnum value : PurposeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown purpose code: " + code);
    }
}
