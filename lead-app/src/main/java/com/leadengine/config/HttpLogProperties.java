package com.leadengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class HttpLogProperties {

    /** 是否启用 HTTP 入口日志。 */
    private boolean enabled = true;

    private List<String> includePathPatterns = Arrays.asList("/api/**");

    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 查询参数中需要脱敏的字段名，手机号与渠道用户 ID 属于个人信息。 */
    private List<String> maskFields = Arrays.asList("phone", "contactPhone", "externalUserId", "token");

    /** 慢请求阈值。 */
    private long slowRequestThresholdMs = 1000L;

    /** 采样比例（0~1）。 */
    private double sampleRate = 1.0D;
}
