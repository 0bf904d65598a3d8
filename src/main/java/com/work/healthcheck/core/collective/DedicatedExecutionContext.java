package com.work.healthcheck.core.collective;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.work.healthcheck.core.support.ValidationUtils.requireNonEmpty;

/**
 * 单线程 daemon executor 实现的执行上下文：同一 side 的工作严格串行，
 * 一个 side 上卡住的工作不会拖住另一个 side。
 */
public class DedicatedExecutionContext implements ExecutionContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(DedicatedExecutionContext.class);

    private final String name;
    private final ExecutorService stream;

    public DedicatedExecutionContext(String name) {
        this.name = requireNonEmpty(name, "name");
        this.stream = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName(name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 为指定 side 创建上下文，线程名为 healthcheck-stream-{side}。
     */
    public static DedicatedExecutionContext forSide(int side) {
        return new DedicatedExecutionContext("healthcheck-stream-" + side);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Executor executor() {
        return stream;
    }

    @Override
    public Binding bind() {
        return ExecutionContextHolder.bind(this);
    }

    @Override
    public void close() {
        // 不等待在途工作：被放弃的探测可能永远不会结束
        stream.shutdownNow();
        LOGGER.debug("[healthcheck] execution context {} closed", name);
    }

    @Override
    public String toString() {
        return name;
    }
}
