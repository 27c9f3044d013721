package com.leadengine.types.exception;

import com.leadengine.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用业务异常，携带响应码与描述信息，由上层统一转换为响应。
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2871904627138814402L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public static AppException illegalParameter(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }

    public static AppException notFound(String message) {
        return new AppException(ResponseCode.NOT_FOUND.getCode(), message);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
