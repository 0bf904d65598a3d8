package com.work.healthcheck.core.collective;

import java.util.concurrent.Executor;

/**
 * 每个 side 独占的执行上下文（类似独立的设备 stream）。
 * 集合通信的异步工作提交到调用线程当前绑定的上下文上执行，不同 side 之间互不排队。
 */
public interface ExecutionContext extends AutoCloseable {

    String getName();

    /**
     * @return 执行异步工作的 executor
     */
    Executor executor();

    /**
     * 将当前线程绑定到该上下文，关闭返回的 Binding 时恢复之前的绑定。
     */
    Binding bind();

    @Override
    void close();

    /**
     * try-with-resources 友好的绑定句柄，close 不抛受检异常。
     */
    interface Binding extends AutoCloseable {
        @Override
        void close();
    }
}
