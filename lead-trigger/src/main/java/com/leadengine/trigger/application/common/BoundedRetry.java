package com.leadengine.trigger.application.common;

import com.leadengine.types.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 出站副作用的有界重试：一次尝试加最多 maxRetries 次重试，退避时间按倍数递增。
 * 只重试暂时性投递失败，永久失败立即抛出。
 */
@Slf4j
@Component
public class BoundedRetry {

    private final int maxRetries;
    private final long initialBackoffMs;
    private final double multiplier;

    public BoundedRetry(@Value("${retry.max-retries:3}") int maxRetries,
                        @Value("${retry.initial-backoff-ms:1000}") long initialBackoffMs,
                        @Value("${retry.multiplier:2}") double multiplier) {
        this.maxRetries = maxRetries >= 0 ? maxRetries : 3;
        this.initialBackoffMs = initialBackoffMs >= 0 ? initialBackoffMs : 1000L;
        this.multiplier = multiplier >= 1D ? multiplier : 2D;
    }

    /**
     * 执行投递动作
     *
     * @param operation 日志中的操作名
     * @throws ChannelDeliveryException 永久失败，或重试耗尽后的最后一次暂时性失败
     */
    public void run(String operation, DeliveryAction action) throws ChannelDeliveryException {
        long backoffMs = initialBackoffMs;
        for (int attempt = 0; ; attempt++) {
            try {
                action.run();
                if (attempt > 0) {
                    log.info("Delivery succeeded after retry. operation={}, retries={}", operation, attempt);
                }
                return;
            } catch (ChannelDeliveryException ex) {
                if (!ex.isTransientFailure() || attempt >= maxRetries) {
                    log.warn("Delivery failed. operation={}, retries={}, transient={}, error={}",
                            operation, attempt, ex.isTransientFailure(), ex.getMessage());
                    throw ex;
                }
                log.debug("Transient delivery failure, retrying. operation={}, attempt={}, backoffMs={}",
                        operation, attempt + 1, backoffMs);
                pause(operation, backoffMs);
                backoffMs = (long) (backoffMs * multiplier);
            }
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private void pause(String operation, long backoffMs) throws ChannelDeliveryException {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException("Delivery retry interrupted: " + operation, false, ex);
        }
    }

    @FunctionalInterface
    public interface DeliveryAction {
        void run() throws ChannelDeliveryException;
    }
}
