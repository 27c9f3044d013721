package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 付款方式枚举
 */
public enum PaymentMethodEnum {

    CASH("cash"),
    INSTALLMENT("installment"),
    MORTGAGE("mortgage");

    private final String code;

    PaymentMethodEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PaymentMethodEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (PaymentMethodEnum value : PaymentMethodEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown payment method code: " + code);
    }
}
