package com.work.healthcheck.core.exception;

import java.time.Duration;

/**
 * 集合通信未在 timeout 内完成。计为本轮一次失败，循环继续。
 */
public class ProbeTimeoutException extends HealthcheckException {

    private final Duration timeout;

    public ProbeTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
