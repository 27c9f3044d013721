package com.leadengine.domain.conversation.model.valobj;

/**
 * 当前待填槽位的输入解析结果。
 *
 * @param kind  MATCH 命中；INVALID 结构化选项与槽位不符；NONE 没有可解析的答案
 * @param value 命中时的规范值，如 investment、2、buy 或手机号
 */
public record SlotInput(Kind kind, String value) {

    public enum Kind {
        MATCH,
        INVALID,
        NONE
    }

    public static SlotInput match(String value) {
        return new SlotInput(Kind.MATCH, value);
    }

    public static SlotInput invalid() {
        return new SlotInput(Kind.INVALID, null);
    }

    public static SlotInput none() {
        return new SlotInput(Kind.NONE, null);
    }

    public boolean isMatch() {
        return kind == Kind.MATCH;
    }
}
