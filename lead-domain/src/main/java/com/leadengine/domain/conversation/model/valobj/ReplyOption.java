package com.leadengine.domain.conversation.model.valobj;

/**
 * 回复中的可选项。
 *
 * @param id    回调 ID，如 budget_2
 * @param label 展示文本
 */
public record ReplyOption(String id, String label) {
}
