package com.leadengine.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 会话状态枚举，线性漏斗
 */
public enum ConversationStateEnum {

    /** 初始状态，尚未选择语言 */
    START("start"),
    /** 等待选择语言 */
    LANGUAGE_SELECT("language_select"),
    /** 等待选择目标 */
    WARMUP("warmup"),
    /** 收集联系方式 */
    CAPTURE_CONTACT("capture_contact"),
    /** 收集预算、物业类型、交易类型 */
    SLOT_FILLING("slot_filling"),
    /** 展示推荐并询问是否需要报告 */
    VALUE_PROPOSITION("value_proposition"),
    /** 报告前必须留下联系方式 */
    HARD_GATE("hard_gate"),
    /** 预约顾问回电 */
    SCHEDULING("scheduling"),
    /** 已移交顾问 */
    COMPLETED("completed"),
    /** 无可触达渠道，等待人工处理 */
    UNREACHABLE("unreachable");

    private final String code;

    ConversationStateEnum(String code) {
        this.code = code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == UNREACHABLE;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ConversationStateEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim();
        for (ConversationStateEnum value : ConversationStateEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown conversation state code: " + code);
    }
}
