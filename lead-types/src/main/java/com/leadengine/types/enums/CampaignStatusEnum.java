package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 跟进活动状态枚举
 */
public enum CampaignStatusEnum {

    /** 草稿 */
    DRAFT("draft"),
    /** 已排期，等待执行 */
    SCHEDULED("scheduled"),
    /** 执行中 */
    RUNNING("running"),
    /** 已完成 */
    COMPLETED("completed"),
    /** 已暂停 */
    PAUSED("paused");

    private final String code;

    CampaignStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static CampaignStatusEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (CampaignStatusEnum value : CampaignStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown campaign status code: " + code);
    }
}
