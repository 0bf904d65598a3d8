package com.work.healthcheck.core.exception;

/**
 * 拓扑参数（rank / worldSize / localWorldSize）或时间参数非法，构造阶段即失败，不重试。
 */
public class ConfigurationException extends HealthcheckException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
