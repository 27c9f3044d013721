package com.leadengine.domain.conversation.service;

import com.leadengine.types.enums.LanguageEnum;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * 按 (消息 ID x 语言) 查询文案，缺失时回退英文。
 */
@Service
public class ConversationMessageCatalog {

    private final MessageSource messageSource;

    public ConversationMessageCatalog(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String text(String messageId, LanguageEnum language, Object... args) {
        Locale locale = localeOf(language);
        try {
            return messageSource.getMessage(messageId, args, locale);
        } catch (NoSuchMessageException ex) {
            if (locale.equals(Locale.ENGLISH)) {
                throw ex;
            }
            return messageSource.getMessage(messageId, args, Locale.ENGLISH);
        }
    }

    /**
     * 面向运营人员的通知统一使用英文
     */
    public String operatorText(String messageId, Object... args) {
        return text(messageId, LanguageEnum.EN, args);
    }

    private Locale localeOf(LanguageEnum language) {
        return language == null ? Locale.ENGLISH : Locale.forLanguageTag(language.getCode());
    }
}
