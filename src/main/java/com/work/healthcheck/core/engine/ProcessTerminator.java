package com.work.healthcheck.core.engine;

/**
 * 进程级终止能力，仅由 {@link AbortPolicy} 调用。
 * 抽成接口以便测试替换；生产实现不得返回。
 */
public interface ProcessTerminator {

    void terminate(String reason);
}
