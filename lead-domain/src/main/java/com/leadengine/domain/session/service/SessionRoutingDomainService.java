package com.leadengine.domain.session.service;

import com.leadengine.domain.session.model.valobj.BootstrapToken;
import com.leadengine.types.common.Constants;
import com.leadengine.types.enums.VerticalEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 深链启动令牌解析。
 */
@Slf4j
@Service
public class SessionRoutingDomainService {

    private static final Pattern TOKEN = Pattern.compile(
            "(?:^|\\s|/start\\s*)" + Constants.BOOTSTRAP_TOKEN_PREFIX + "([a-z]+)_(\\d{1,18})(?=$|\\s)",
            Pattern.CASE_INSENSITIVE);

    /**
     * 从消息文本中解析启动令牌，业务线未知时视为无令牌
     */
    public BootstrapToken parseToken(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher matcher = TOKEN.matcher(text.trim());
        if (!matcher.find()) {
            return null;
        }
        VerticalEnum vertical;
        try {
            vertical = VerticalEnum.fromCode(matcher.group(1));
        } catch (IllegalArgumentException ex) {
            log.info("Ignore bootstrap token with unknown vertical. token={}", matcher.group());
            return null;
        }
        return new BootstrapToken(vertical, Long.parseLong(matcher.group(2)),
                Constants.BOOTSTRAP_TOKEN_PREFIX + matcher.group(1) + "_" + matcher.group(2));
    }

    /**
     * 去掉令牌（及 Telegram 的 /start 前缀）后的剩余文本
     */
    public String stripToken(String text, BootstrapToken token) {
        if (text == null || token == null) {
            return text;
        }
        String stripped = Pattern.compile(Pattern.quote(token.raw()), Pattern.CASE_INSENSITIVE)
                .matcher(text).replaceFirst("");
        stripped = StringUtils.removeStartIgnoreCase(stripped.trim(), "/start");
        return StringUtils.trimToNull(stripped);
    }
}
