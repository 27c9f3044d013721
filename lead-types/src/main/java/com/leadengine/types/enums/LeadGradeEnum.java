package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 线索等级枚举，由评分推导
 */
public enum LeadGradeEnum {

    A("A"),
    B("B"),
    C("C"),
    D("D");

    private final String code;

    LeadGradeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LeadGradeEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (LeadGradeEnum value : LeadGradeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lead grade code: " + code);
    }
}
