package com.work.healthcheck.core.engine.spi;

/**
 * 具体探测方式的扩展点。HealthLoop 只负责调度、超时与汇总，
 * 每个 side 上的建连与单次探测由实现方提供。
 */
public interface ProbeStrategy extends AutoCloseable {

    /**
     * @return 需要 setup 的 side 数量，也是 abort 判定的阈值
     */
    int sideCount();

    /**
     * 同步、阻塞地为 side 建立探测资源，每个 side 只调用一次，且先于第一轮探测。
     *
     * @throws com.work.healthcheck.core.exception.SetupException 建立失败
     */
    void setup(int side);

    /**
     * 执行一次探测，正常返回即成功，失败以异常表示。
     * 实现不得修改 HealthLoop 的共享状态。
     */
    void probe(int side);

    /**
     * 释放所有 side 的资源。
     */
    @Override
    void close();
}
