package com.leadengine.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("0003", "资源不存在"),

    /** 渠道不可用 */
    CHANNEL_UNAVAILABLE("0004", "渠道不可用"),

    /** 并发修改冲突 */
    CONCURRENT_MODIFICATION("0005", "并发修改冲突");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
