package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 物业类型枚举
 */
public enum PropertyTypeEnum {

    APARTMENT("apartment"),
    VILLA("villa"),
    PENTHOUSE("penthouse"),
    TOWNHOUSE("townhouse"),
    COMMERCIAL("commercial"),
    LAND("land");

    private final String code;

    PropertyTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PropertyTypeEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (PropertyTypeEnum value : PropertyTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown property type code: " + code);
    }
}
