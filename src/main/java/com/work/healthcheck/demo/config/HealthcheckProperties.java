package com.work.healthcheck.demo.config;

import com.work.healthcheck.core.config.ProbeMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 仅存在于 demo 包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.healthcheck.core.config.HealthcheckConfig}。
 */
@Validated
@ConfigurationProperties(prefix = "healthcheck")
public class HealthcheckProperties {

    /**
     * 是否启动健康检查循环。
     */
    private boolean enabled = false;

    /**
     * 所有 channel 在同一轮失败时是否终止进程。
     */
    private boolean abortOnError = true;

    /**
     * 两轮之间的间隔。
     */
    @NotNull
    private Duration interval = Duration.ofSeconds(60);

    /**
     * 单轮探测的 deadline。
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * setup 阶段等待配对成员到齐的最长时间。
     */
    @NotNull
    private Duration setupTimeout = Duration.ofMinutes(5);

    @NotNull
    private ProbeMode probeMode = ProbeMode.ALL_SIDES;

    /**
     * 超时的探测任务是否中断（默认仅放弃）。
     */
    private boolean cancelTimedOutProbes = false;

    @Min(0)
    private int rank = 0;

    @Min(1)
    private int worldSize = 2;

    @Min(1)
    private int localWorldSize = 1;

    @Valid
    private final Store store = new Store();

    public static class Store {

        /**
         * redis：跨进程共享；memory：仅用于单 JVM 内模拟。
         */
        @NotBlank
        private String type = "redis";

        /**
         * 作业运行标识，隔离不同运行残留在 Redis 中的 key。
         */
        @NotBlank
        private String namespace = "healthcheck";

        /**
         * Redis 等待 key 时的轮询间隔。
         */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(20);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAbortOnError() {
        return abortOnError;
    }

    public void setAbortOnError(boolean abortOnError) {
        this.abortOnError = abortOnError;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getSetupTimeout() {
        return setupTimeout;
    }

    public void setSetupTimeout(Duration setupTimeout) {
        this.setupTimeout = setupTimeout;
    }

    public ProbeMode getProbeMode() {
        return probeMode;
    }

    public void setProbeMode(ProbeMode probeMode) {
        this.probeMode = probeMode;
    }

    public boolean isCancelTimedOutProbes() {
        return cancelTimedOutProbes;
    }

    public void setCancelTimedOutProbes(boolean cancelTimedOutProbes) {
        this.cancelTimedOutProbes = cancelTimedOutProbes;
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public int getWorldSize() {
        return worldSize;
    }

    public void setWorldSize(int worldSize) {
        this.worldSize = worldSize;
    }

    public int getLocalWorldSize() {
        return localWorldSize;
    }

    public void setLocalWorldSize(int localWorldSize) {
        this.localWorldSize = localWorldSize;
    }

    public Store getStore() {
        return store;
    }
}
