package com.work.healthcheck.core.exception;

/**
 * 健康检查组件内部的统一异常类型，便于宿主捕获或转换为运维告警。
 */
public class HealthcheckException extends RuntimeException {

    public HealthcheckException(String message) {
        super(message);
    }

    public HealthcheckException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否阻止引擎启动。
     * 默认不致命：单轮内的失败由 HealthLoop 吸收并计入 failureCount。
     */
    public boolean isFatal() {
        return false;
    }
}
