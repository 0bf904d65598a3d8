package com.work.healthcheck.core.engine;

import com.work.healthcheck.core.config.HealthcheckConfig;
import com.work.healthcheck.core.engine.spi.ProbeStrategy;
import com.work.healthcheck.core.exception.ProbeTimeoutException;
import com.work.healthcheck.core.support.metrics.HealthcheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 常驻的健康检查调度器。
 * <p>
 * 生命周期：INITIALIZING →（所有 side setup 完成）→ RUNNING →（shutdown）→ SHUTTING_DOWN → STOPPED。
 * <p>
 * 每一轮：
 * 1) deadline = now + timeout
 * 2) 每个 side 一个并发探测任务
 * 3) 逐个等待到 deadline，未完成的记为 TIMEOUT（不强制取消，任务被放弃）
 * 4) 汇总失败数 → AbortPolicy
 * 5) 等待 interval 或 shutdown 信号
 * <p>
 * 单轮内的失败全部在此吸收，不向外传播；只有 setup 失败会从 {@link #start()} 抛出。
 */
public class HealthLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthLoop.class);

    private final HealthcheckConfig config;
    private final ProbeStrategy strategy;
    private final AbortPolicy abortPolicy;
    private final HealthcheckMetrics metrics;
    private final ShutdownCoordinator coordinator = new ShutdownCoordinator();
    private final ExecutorService probePool;

    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.INITIALIZING);
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean released = new AtomicBoolean();
    private final AtomicLong roundsCompleted = new AtomicLong();
    private volatile RoundResult lastRound;

    public HealthLoop(HealthcheckConfig config,
                      ProbeStrategy strategy,
                      ProcessTerminator terminator,
                      HealthcheckMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.abortPolicy = new AbortPolicy(strategy.sideCount(), config.isAbortOnError(), terminator, metrics);
        AtomicInteger threadIndex = new AtomicInteger();
        this.probePool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("healthcheck-probe-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 同步地按 side 递增顺序完成 setup，然后启动唯一的后台线程。
     *
     * @throws com.work.healthcheck.core.exception.SetupException setup 失败，引擎进入 STOPPED
     * @throws IllegalStateException                              重复启动或已被关闭
     */
    public void start() {
        if (coordinator.isShutdownRequested()) {
            throw new IllegalStateException("healthcheck already shut down");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("healthcheck already started");
        }
        LOGGER.info("[healthcheck] setup... config={}", config);
        try {
            for (int side = 0; side < strategy.sideCount(); side++) {
                LOGGER.info("[healthcheck] setup side={} start", side);
                strategy.setup(side);
                LOGGER.info("[healthcheck] setup side={} complete", side);
            }
        } catch (RuntimeException e) {
            LOGGER.error("[healthcheck] setup failed, healthcheck will not run", e);
            state.set(EngineState.STOPPED);
            release();
            coordinator.markExited();
            throw e;
        }
        LOGGER.info("[healthcheck] setup complete!");

        Thread worker = new Thread(this::runLoop, "healthcheck-loop");
        worker.setDaemon(true);
        if (!coordinator.registerWorker(worker)) {
            LOGGER.info("[healthcheck] shutdown requested during setup, loop not started");
            state.set(EngineState.STOPPED);
            release();
            coordinator.markExited();
            return;
        }
        state.compareAndSet(EngineState.INITIALIZING, EngineState.RUNNING);
        worker.start();
    }

    /**
     * 请求停止并阻塞直到后台线程退出。可重复调用，可在任意线程调用。
     */
    public void shutdown() {
        if (state.get() == EngineState.STOPPED && coordinator.isExited()) {
            return;
        }
        LOGGER.info("[healthcheck] shutdown requested, state={}", state.get());
        state.compareAndSet(EngineState.RUNNING, EngineState.SHUTTING_DOWN);
        boolean joined = coordinator.requestShutdown();
        if (!started.get()) {
            state.set(EngineState.STOPPED);
            release();
            coordinator.markExited();
        } else if (joined) {
            LOGGER.info("[healthcheck] shutdown complete");
        }
        // 其余情况：setup 仍在 start() 线程中进行，由 start() 在登记线程时发现 shutdown 并释放资源
    }

    private void runLoop() {
        long round = 0L;
        try {
            while (!coordinator.isShutdownRequested()) {
                runRound(++round);
                if (coordinator.awaitNextRound(config.getInterval())) {
                    break;
                }
            }
            state.set(EngineState.SHUTTING_DOWN);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("[healthcheck] loop interrupted after round={}", round);
        } catch (RuntimeException e) {
            LOGGER.error("[healthcheck] loop failed after round={}", round, e);
        } finally {
            release();
            state.set(EngineState.STOPPED);
            coordinator.markExited();
            LOGGER.info("[healthcheck] loop exited after {} rounds", roundsCompleted.get());
        }
    }

    RoundResult runRound(long round) {
        int sides = config.getProbeMode().probedSides(strategy.sideCount());
        LOGGER.info("[healthcheck] running healthchecks round={} sides={}", round, sides);

        Instant startedAt = Instant.now();
        long deadline = System.nanoTime() + config.getTimeout().toNanos();

        List<Future<?>> futures = new ArrayList<>(sides);
        for (int side = 0; side < sides; side++) {
            final int s = side;
            futures.add(probePool.submit(() -> {
                strategy.probe(s);
                LOGGER.debug("[healthcheck] worker exit side={}", s);
                return null;
            }));
        }

        List<ProbeOutcome> outcomes = new ArrayList<>(sides);
        for (int side = 0; side < sides; side++) {
            Future<?> future = futures.get(side);
            ProbeOutcome outcome;
            try {
                future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                outcome = ProbeOutcome.success(side);
                LOGGER.info("[healthcheck] round={} side={} passed", round, side);
            } catch (TimeoutException e) {
                outcome = ProbeOutcome.timeout(side);
                if (config.isCancelTimedOutProbes()) {
                    future.cancel(true);
                }
                LOGGER.error("[healthcheck] round={} side={} timed out after {}", round, side, config.getTimeout());
            } catch (ExecutionException e) {
                if (e.getCause() instanceof ProbeTimeoutException) {
                    // 探测自身的 await 先于 deadline 检查超时
                    outcome = ProbeOutcome.timeout(side);
                    LOGGER.error("[healthcheck] round={} side={} timed out: {}", round, side, e.getCause().getMessage());
                } else {
                    outcome = ProbeOutcome.failure(side, e.getCause());
                    LOGGER.error("[healthcheck] round={} side={} failed: {}", round, side, outcome.getReason());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = ProbeOutcome.failure(side, e);
                LOGGER.warn("[healthcheck] round={} side={} wait interrupted", round, side);
            }
            metrics.probe(side, outcome.getStatus());
            outcomes.add(outcome);
        }

        RoundResult result = new RoundResult(round, startedAt, outcomes);
        LOGGER.info("[healthcheck] round={} had {} failures", round, result.getFailureCount());
        coordinator.recordFailures(result.getFailureCount());
        lastRound = result;
        roundsCompleted.incrementAndGet();
        metrics.round(result.getFailureCount());

        abortPolicy.evaluate(result);
        return result;
    }

    private void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        probePool.shutdownNow();
        try {
            strategy.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[healthcheck] failed to release probe strategy", e);
        }
    }

    public EngineState getState() {
        return state.get();
    }

    /**
     * @return 最近一轮的失败数，第一轮完成前为 -1
     */
    public int getLastFailureCount() {
        return coordinator.getLastFailureCount();
    }

    /**
     * @return 最近一轮结果，第一轮完成前为 null
     */
    public RoundResult getLastRound() {
        return lastRound;
    }

    public long getRoundsCompleted() {
        return roundsCompleted.get();
    }
}
