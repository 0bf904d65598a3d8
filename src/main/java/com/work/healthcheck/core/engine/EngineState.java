package com.work.healthcheck.core.engine;

/**
 * 健康检查引擎的生命周期状态，任一时刻只处于其中之一。
 */
public enum EngineState {
    /** 已构造，正在（或尚未开始）为各 side 建立 channel。 */
    INITIALIZING,
    /** 后台循环正在按 interval 执行探测轮次。 */
    RUNNING,
    /** 已收到 shutdown 请求，等待后台循环退出。 */
    SHUTTING_DOWN,
    /** 后台循环已退出（正常关闭或 setup 失败），资源已释放。 */
    STOPPED
}
