package com.work.healthcheck.core.collective;

/**
 * 为每个 side 分配独立的执行上下文。
 */
public interface ExecutionContextFactory {

    ExecutionContext create(int side);

    static ExecutionContextFactory dedicated() {
        return DedicatedExecutionContext::forSide;
    }
}
