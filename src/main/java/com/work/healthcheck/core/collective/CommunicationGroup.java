package com.work.healthcheck.core.collective;

/**
 * 已建立的通信组（一对主机上的全部 rank）。
 */
public interface CommunicationGroup extends AutoCloseable {

    int rank();

    int size();

    /**
     * 对 payload 做 sum all-reduce，完成后 payload 被原地替换为规约结果。
     * 工作在调用线程当前绑定的 {@link ExecutionContext} 上异步执行。
     *
     * @return 可等待的句柄
     */
    ReductionWork allReduceSum(float[] payload);

    @Override
    void close();
}
