package com.work.healthcheck.core.config;

import com.work.healthcheck.core.exception.ConfigurationException;

import java.time.Duration;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class HealthcheckConfig {

    private final boolean abortOnError;
    private final Duration interval;
    private final Duration timeout;
    private final Duration setupTimeout;
    private final ProbeMode probeMode;
    private final boolean cancelTimedOutProbes;

    public HealthcheckConfig(boolean abortOnError,
                             Duration interval,
                             Duration timeout,
                             Duration setupTimeout,
                             ProbeMode probeMode,
                             boolean cancelTimedOutProbes) {
        this.abortOnError = abortOnError;
        this.interval = requirePositive(interval, "interval");
        this.timeout = requirePositive(timeout, "timeout");
        this.setupTimeout = requirePositive(setupTimeout, "setupTimeout");
        this.probeMode = probeMode == null ? ProbeMode.ALL_SIDES : probeMode;
        this.cancelTimedOutProbes = cancelTimedOutProbes;
    }

    public HealthcheckConfig(boolean abortOnError, Duration interval, Duration timeout) {
        this(abortOnError, interval, timeout, Duration.ofMinutes(5), ProbeMode.ALL_SIDES, false);
    }

    public static HealthcheckConfig defaultConfig() {
        return new HealthcheckConfig(true, Duration.ofSeconds(60), Duration.ofSeconds(10));
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
        return value;
    }

    public boolean isAbortOnError() {
        return abortOnError;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getSetupTimeout() {
        return setupTimeout;
    }

    public ProbeMode getProbeMode() {
        return probeMode;
    }

    public boolean isCancelTimedOutProbes() {
        return cancelTimedOutProbes;
    }

    @Override
    public String toString() {
        return "HealthcheckConfig{abortOnError=" + abortOnError
                + ", interval=" + interval
                + ", timeout=" + timeout
                + ", setupTimeout=" + setupTimeout
                + ", probeMode=" + probeMode
                + ", cancelTimedOutProbes=" + cancelTimedOutProbes + '}';
    }
}
