package com.leadengine.domain.conversation.service;

import com.leadengine.domain.conversation.model.valobj.BudgetBracket;
import com.leadengine.domain.conversation.model.valobj.SlotInput;
import com.leadengine.domain.lead.service.LeadIdentityDomainService;
import com.leadengine.types.enums.ConversationSlotEnum;
import com.leadengine.types.enums.LanguageEnum;
import com.leadengine.types.enums.PropertyTypeEnum;
import com.leadengine.types.enums.PurposeEnum;
import com.leadengine.types.enums.TransactionTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 会话输入解析：结构化回调 ID 与每个槽位的少量自由文本语法。
 * <p>
 * 不做自然语言理解，不在语法内的文本一律返回 NONE，由引擎按插话处理。
 * </p>
 */
@Service
public class ConversationInputDomainService {

    public static final String CHOICE_CONTACT_SHARED = "contact_shared";
    public static final String CHOICE_CONTACT_SKIP = "contact_skip";

    private static final Pattern AMOUNT = Pattern.compile(
            "^\\$?\\s*(\\d+(?:[.,]\\d+)?)\\s*(k|m|thousand|million)?\\s*(aed|usd|\\$)?$");

    private static final Pattern PHONE_TEXT = Pattern.compile("^\\+?[\\d\\s\\-().]+$");

    private static final Pattern BUDGET_CHOICE = Pattern.compile("^budget_(\\d{1,2})$");

    private static final Map<LanguageEnum, List<String>> LANGUAGE_WORDS = Map.of(
            LanguageEnum.EN, List.of("en", "english", "eng"),
            LanguageEnum.FA, List.of("fa", "farsi", "persian", "فارسی"),
            LanguageEnum.AR, List.of("ar", "arabic", "عربي", "العربية"),
            LanguageEnum.RU, List.of("ru", "russian", "русский"));

    private static final Map<PurposeEnum, List<String>> GOAL_WORDS = Map.of(
            PurposeEnum.INVESTMENT, List.of("investment", "invest", "سرمایه گذاری", "استثمار", "инвестиции"),
            PurposeEnum.LIVING, List.of("living", "live", "زندگی", "سكن", "жить"),
            PurposeEnum.RESIDENCY, List.of("residency", "visa", "golden visa", "اقامت", "إقامة", "резидентство"));

    private static final Map<TransactionTypeEnum, List<String>> TRANSACTION_WORDS = Map.of(
            TransactionTypeEnum.BUY, List.of("buy", "purchase", "خرید", "شراء", "купить"),
            TransactionTypeEnum.RENT, List.of("rent", "lease", "اجاره", "إيجار", "аренда"));

    private static final List<String> YES_WORDS = List.of("yes", "y", "sure", "ok", "بله", "آره", "نعم", "да");
    private static final List<String> NO_WORDS = List.of("no", "n", "no thanks", "نه", "خیر", "لا", "нет");
    private static final List<String> SCHEDULE_CODES = List.of("morning", "afternoon", "evening", "none");

    private final LeadIdentityDomainService leadIdentityDomainService;

    public ConversationInputDomainService(LeadIdentityDomainService leadIdentityDomainService) {
        this.leadIdentityDomainService = leadIdentityDomainService;
    }

    /**
     * 解析待填槽位的输入。结构化回调 ID 优先于自由文本。
     */
    public SlotInput parse(ConversationSlotEnum slot, String freeText, String choiceId) {
        if (slot == null) {
            return SlotInput.none();
        }
        String choice = StringUtils.trimToNull(choiceId);
        if (choice != null) {
            String value = parseChoice(slot, choice.toLowerCase(Locale.ROOT));
            return value == null ? SlotInput.invalid() : SlotInput.match(value);
        }
        String text = normalizeText(freeText);
        if (text == null) {
            return SlotInput.none();
        }
        String value = parseText(slot, text);
        return value == null ? SlotInput.none() : SlotInput.match(value);
    }

    private String parseChoice(ConversationSlotEnum slot, String choice) {
        switch (slot) {
            case LANGUAGE:
                return enumSuffix(choice, "lang_", LanguageEnum.values());
            case GOAL:
                return enumSuffix(choice, "goal_", PurposeEnum.values());
            case CONTACT:
                if (CHOICE_CONTACT_SHARED.equals(choice) || CHOICE_CONTACT_SKIP.equals(choice)) {
                    return choice;
                }
                return null;
            case BUDGET:
                Matcher budget = BUDGET_CHOICE.matcher(choice);
                if (!budget.matches()) {
                    return null;
                }
                int index = Integer.parseInt(budget.group(1));
                return BudgetBracket.ofIndex(index) == null ? null : String.valueOf(index);
            case PROPERTY_TYPE:
                return enumSuffix(choice, "prop_", PropertyTypeEnum.values());
            case TRANSACTION_TYPE:
                return enumSuffix(choice, "tx_", TransactionTypeEnum.values());
            case REPORT:
                if ("report_yes".equals(choice)) {
                    return "yes";
                }
                return "report_no".equals(choice) ? "no" : null;
            case SCHEDULE:
                String code = StringUtils.removeStart(choice, "schedule_");
                return !code.equals(choice) && SCHEDULE_CODES.contains(code) ? code : null;
            default:
                return null;
        }
    }

    private String parseText(ConversationSlotEnum slot, String text) {
        switch (slot) {
            case LANGUAGE:
                return keyword(text, LANGUAGE_WORDS);
            case GOAL:
                return keyword(text, GOAL_WORDS);
            case CONTACT:
                return PHONE_TEXT.matcher(text).matches() ? leadIdentityDomainService.normalizePhone(text) : null;
            case BUDGET:
                BudgetBracket bracket = BudgetBracket.containing(parseAmount(text));
                return bracket == null ? null : String.valueOf(bracket.getIndex());
            case PROPERTY_TYPE:
                String singular = StringUtils.removeEnd(text, "s");
                for (PropertyTypeEnum type : PropertyTypeEnum.values()) {
                    if (type.getCode().equals(text) || type.getCode().equals(singular)) {
                        return type.getCode();
                    }
                }
                return null;
            case TRANSACTION_TYPE:
                return keyword(text, TRANSACTION_WORDS);
            case REPORT:
                if (YES_WORDS.contains(text)) {
                    return "yes";
                }
                return NO_WORDS.contains(text) ? "no" : null;
            case SCHEDULE:
                return SCHEDULE_CODES.contains(text) && !"none".equals(text) ? text : null;
            default:
                return null;
        }
    }

    /**
     * 仅当整条文本是一个金额时解析，如 1.5m、800k、2000000 aed
     */
    BigDecimal parseAmount(String text) {
        Matcher matcher = AMOUNT.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        BigDecimal amount = new BigDecimal(matcher.group(1).replace(',', '.'));
        String unit = matcher.group(2);
        if ("k".equals(unit) || "thousand".equals(unit)) {
            amount = amount.multiply(BigDecimal.valueOf(1_000L));
        } else if ("m".equals(unit) || "million".equals(unit)) {
            amount = amount.multiply(BigDecimal.valueOf(1_000_000L));
        }
        return amount;
    }

    private <E extends Enum<E>> String enumSuffix(String choice, String prefix, E[] values) {
        if (!choice.startsWith(prefix)) {
            return null;
        }
        String suffix = choice.substring(prefix.length());
        for (E value : values) {
            if (codeOf(value).equals(suffix)) {
                return suffix;
            }
        }
        return null;
    }

    private <E extends Enum<E>> String keyword(String text, Map<E, List<String>> words) {
        for (Map.Entry<E, List<String>> entry : words.entrySet()) {
            if (entry.getValue().contains(text)) {
                return codeOf(entry.getKey());
            }
        }
        return null;
    }

    private String codeOf(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private String normalizeText(String freeText) {
        String text = StringUtils.trimToNull(freeText);
        if (text == null) {
            return null;
        }
        text = StringUtils.removeEnd(text, ".");
        text = StringUtils.removeEnd(text, "!");
        return StringUtils.normalizeSpace(text.toLowerCase(Locale.ROOT));
    }
}
