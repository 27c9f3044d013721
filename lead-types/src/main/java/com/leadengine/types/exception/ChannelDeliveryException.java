package com.leadengine.types.exception;

import com.leadengine.types.enums.ResponseCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 出站消息投递失败。transientFailure 为 true 时允许退避重试。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class ChannelDeliveryException extends AppException {

    private static final long serialVersionUID = -4471853609925032710L;

    private final boolean transientFailure;

    public ChannelDeliveryException(String message, boolean transientFailure) {
        super(ResponseCode.CHANNEL_UNAVAILABLE.getCode(), message);
        this.transientFailure = transientFailure;
    }

    public ChannelDeliveryException(String message, boolean transientFailure, Throwable cause) {
        super(ResponseCode.CHANNEL_UNAVAILABLE.getCode(), message, cause);
        this.transientFailure = transientFailure;
    }
}
