package com.work.healthcheck.core.support.metrics;

import com.work.healthcheck.core.engine.ProbeStatus;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface HealthcheckMetrics {

    default void probe(int side, ProbeStatus status) {
    }

    default void round(int failureCount) {
    }

    default void abort() {
    }
}
