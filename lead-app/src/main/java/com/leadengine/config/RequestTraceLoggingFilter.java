package com.leadengine.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器：写入 traceId/requestId 到 MDC 与响应头，记录入口与耗时。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final HttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(HttpLogProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String path = request.getRequestURI();
        String method = request.getMethod();
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path, sanitizeQuery(request.getQueryString()));
        }
        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, response.getStatus(), costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (sampled || slow) {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=success, slow={}",
                        method, path, response.getStatus(), costMs, slow);
            }
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreate(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String sanitizeQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        List<String> sanitized = new ArrayList<>();
        for (String part : queryString.split("&")) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (isMaskField(kv[0])) {
                sanitized.add(kv[0] + "=***");
            } else {
                sanitized.add(kv[0] + "=" + StringUtils.abbreviate(kv.length > 1 ? kv[1] : "", 80));
            }
        }
        return sanitized.isEmpty() ? "-" : String.join("&", sanitized);
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (StringUtils.isBlank(key) || maskFields == null) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (String maskField : maskFields) {
            if (StringUtils.isNotBlank(maskField) && normalized.equals(maskField.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
