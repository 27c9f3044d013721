package com.leadengine.trigger.http;

import com.leadengine.api.response.Response;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理，业务错误以响应码返回，未知错误记录堆栈。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        logWarn(request, ex, code, info);
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), 300);
        logWarn(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return Response.<Object>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(info)
                .build();
    }

    /**
     * 并发写入撞上租户内唯一键，调用方重发即可
     */
    @ExceptionHandler(DuplicateKeyException.class)
    public Response<Object> handleDuplicateKeyException(DuplicateKeyException ex, HttpServletRequest request) {
        logWarn(request, ex, ResponseCode.CONCURRENT_MODIFICATION.getCode(), truncate(ex.getMessage(), 300));
        return Response.<Object>builder()
                .code(ResponseCode.CONCURRENT_MODIFICATION.getCode())
                .info(ResponseCode.CONCURRENT_MODIFICATION.getInfo())
                .build();
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage(), 300),
                ex);
        return Response.<Object>builder()
                .code(ResponseCode.UN_ERROR.getCode())
                .info(ResponseCode.UN_ERROR.getInfo())
                .build();
    }

    private void logWarn(HttpServletRequest request, Exception ex, String code, String info) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                code,
                info);
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
