package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 自动跟进阶段枚举，阶段由已跟进次数推导。
 */
public enum FollowupStageEnum {

    INTRODUCTION(0, "introduction"),
    VALUE(1, "value"),
    URGENCY(2, "urgency"),
    LAST_CHANCE(3, "last_chance"),
    GRACEFUL_EXIT(4, "graceful_exit");

    public static final int MAX_FOLLOWUPS = 5;

    private final int index;
    private final String code;

    FollowupStageEnum(int index, String code) {
        this.index = index;
        this.code = code;
    }

    public int getIndex() {
        return index;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 根据已跟进次数获取下一次触达的阶段。
     *
     * @param followupCount 已跟进次数
     * @return 阶段，次数已达上限时返回 null
     */
    public static FollowupStageEnum fromCount(int followupCount) {
        if (followupCount < 0 || followupCount >= MAX_FOLLOWUPS) {
            return null;
        }
        return values()[followupCount];
    }
}
