package com.work.healthcheck.core.probe;

import com.work.healthcheck.core.collective.ExecutionContext;
import com.work.healthcheck.core.collective.ReductionWork;
import com.work.healthcheck.core.exception.DataIntegrityException;
import com.work.healthcheck.core.exception.HealthcheckException;
import com.work.healthcheck.core.exception.ProbeFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static com.work.healthcheck.core.support.ValidationUtils.requirePositive;

/**
 * 在一个 channel 上执行一次探测：对单元素向量 {1.0} 做 sum all-reduce 并校验结果。
 * <p>
 * 配对的两台主机各有 localWorldSize 个 rank，结果应为 2.0 * localWorldSize。
 */
public class ProbeRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProbeRunner.class);

    private final Duration timeout;
    private final double expected;

    public ProbeRunner(Duration timeout, int localWorldSize) {
        this.timeout = requirePositive(timeout, "timeout");
        if (localWorldSize <= 0) {
            throw new IllegalArgumentException("localWorldSize 必须大于0");
        }
        this.expected = 2.0 * localWorldSize;
    }

    /**
     * @throws com.work.healthcheck.core.exception.ProbeTimeoutException 未在 timeout 内完成
     * @throws DataIntegrityException                                   结果不等于期望值
     * @throws ProbeFaultException                                      其它故障
     */
    public void run(ProbeChannel channel) {
        int side = channel.getSide();
        ExecutionContext context = channel.getExecutionContext();
        LOGGER.debug("[healthcheck] running probe side={} context={}", side, context.getName());

        float[] payload = new float[]{1.0f};
        try (ExecutionContext.Binding ignored = context.bind()) {
            LOGGER.debug("[healthcheck] allreduce side={}", side);
            ReductionWork work = channel.getGroup().allReduceSum(payload);
            work.await(timeout);
        } catch (HealthcheckException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProbeFaultException("probe side=" + side + " failed: " + e, e);
        }

        double actual = payload[0];
        if (actual != expected) {
            throw new DataIntegrityException(expected, actual);
        }
        LOGGER.debug("[healthcheck] probe success side={}", side);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public double getExpected() {
        return expected;
    }
}
