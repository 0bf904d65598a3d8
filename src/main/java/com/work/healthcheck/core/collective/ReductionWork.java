package com.work.healthcheck.core.collective;

import java.time.Duration;

/**
 * 一次异步集合操作的句柄。
 */
public interface ReductionWork {

    /**
     * 阻塞直到操作完成。
     *
     * @param timeout 最长等待时间
     * @throws com.work.healthcheck.core.exception.ProbeTimeoutException 未在 timeout 内完成
     * @throws com.work.healthcheck.core.exception.ProbeFaultException   操作本身失败
     */
    void await(Duration timeout);

    boolean isCompleted();
}
