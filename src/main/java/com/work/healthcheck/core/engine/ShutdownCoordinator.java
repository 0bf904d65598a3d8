package com.work.healthcheck.core.engine;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 后台循环与外部调用方之间唯一的跨线程可变状态：shutdown 标志与最近一轮失败数，
 * 由同一把锁保护。
 * <p>
 * interval 等待与 shutdown 标志检查使用同一把锁，因此在循环进入等待之前请求 shutdown 也不会丢失唤醒。
 */
public class ShutdownCoordinator {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private final Condition exitedCondition = lock.newCondition();

    private boolean shutdownRequested;
    private boolean exited;
    private int lastFailureCount = -1;
    private Thread worker;

    /**
     * 登记后台线程。
     *
     * @return false 表示 shutdown 已被请求，调用方不应再启动该线程
     */
    public boolean registerWorker(Thread thread) {
        lock.lock();
        try {
            if (shutdownRequested) {
                return false;
            }
            this.worker = thread;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 等待 interval 结束或 shutdown 信号，以先到者为准。
     *
     * @return true 表示 shutdown 已被请求
     */
    public boolean awaitNextRound(Duration interval) throws InterruptedException {
        lock.lock();
        try {
            long remaining = interval.toNanos();
            while (!shutdownRequested && remaining > 0L) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            return shutdownRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 置位 shutdown 标志并唤醒后台循环，然后阻塞直到后台线程退出。
     * 可重复调用；从后台线程自身调用时不等待。
     *
     * @return true 表示已等到后台线程退出；false 表示尚无已登记的后台线程（或由其自身调用）
     */
    public boolean requestShutdown() {
        lock.lock();
        try {
            shutdownRequested = true;
            wakeUp.signalAll();
            if (worker == null || worker == Thread.currentThread()) {
                return false;
            }
            while (!exited) {
                exitedCondition.awaitUninterruptibly();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdownRequested() {
        lock.lock();
        try {
            return shutdownRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 后台线程退出前调用，唤醒所有阻塞在 {@link #requestShutdown()} 上的调用方。
     */
    public void markExited() {
        lock.lock();
        try {
            exited = true;
            exitedCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isExited() {
        lock.lock();
        try {
            return exited;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailures(int failureCount) {
        lock.lock();
        try {
            this.lastFailureCount = failureCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 最近一轮的失败数，第一轮完成前为 -1
     */
    public int getLastFailureCount() {
        lock.lock();
        try {
            return lastFailureCount;
        } finally {
            lock.unlock();
        }
    }
}
