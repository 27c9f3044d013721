package com.leadengine.domain.conversation.adapter.gateway;

import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.LanguageEnum;

/**
 * 外部问答能力：回答会话中的开放问题。
 */
public interface IKnowledgeResponder {

    /**
     * @return 回答文本；不可用时返回 null，由调用方降级
     */
    String answer(String question, LanguageEnum language, LeadEntity lead);
}
