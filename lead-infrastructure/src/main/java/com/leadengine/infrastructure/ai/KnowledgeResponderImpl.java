package com.leadengine.infrastructure.ai;

import com.leadengine.domain.conversation.adapter.gateway.IKnowledgeResponder;
import com.leadengine.domain.lead.model.entity.LeadEntity;
import com.leadengine.types.enums.LanguageEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring AI ChatClient 的开放问题应答。
 * <p>
 * 调用失败或返回空文本时返回 null，会话引擎使用本地化兜底回复。
 * </p>
 */
@Slf4j
@Component
public class KnowledgeResponderImpl implements IKnowledgeResponder {

    private static final String SYSTEM_PROMPT =
            "You are a concise real estate assistant. Answer the client's question in at most three sentences. "
                    + "Do not invent prices or availability. Do not ask follow-up questions.";

    private final ChatClient chatClient;
    private final boolean enabled;
    private final int maxQuestionLength;

    public KnowledgeResponderImpl(ChatClient.Builder chatClientBuilder,
                                  @Value("${knowledge.enabled:true}") boolean enabled,
                                  @Value("${knowledge.max-question-length:1000}") int maxQuestionLength) {
        this.chatClient = chatClientBuilder.defaultSystem(SYSTEM_PROMPT).build();
        this.enabled = enabled;
        this.maxQuestionLength = maxQuestionLength > 0 ? maxQuestionLength : 1000;
    }

    @Override
    public String answer(String question, LanguageEnum language, LeadEntity lead) {
        if (!enabled || StringUtils.isBlank(question)) {
            return null;
        }
        String languageCode = language == null ? LanguageEnum.EN.getCode() : language.getCode();
        String prompt = "Reply in language: " + languageCode + "\n"
                + "Question: " + StringUtils.abbreviate(question.trim(), maxQuestionLength);
        try {
            String response = chatClient.prompt().user(prompt).call().content();
            if (StringUtils.isBlank(response)) {
                log.warn("Knowledge responder returned empty answer. leadId={}", lead == null ? null : lead.getId());
                return null;
            }
            return response.trim();
        } catch (RuntimeException ex) {
            log.warn("Knowledge responder failed. leadId={}, error={}",
                    lead == null ? null : lead.getId(), ex.getMessage());
            return null;
        }
    }
}
