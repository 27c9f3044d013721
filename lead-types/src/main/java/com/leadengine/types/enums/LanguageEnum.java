package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 会话语言枚举
 */
public enum LanguageEnum {

    EN("en"),
    FA("fa"),
    AR("ar"),
    RU("ru");

    private final String code;

    LanguageEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LanguageEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (LanguageEnum value : LanguageEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown language code: " + code);
    }
}
