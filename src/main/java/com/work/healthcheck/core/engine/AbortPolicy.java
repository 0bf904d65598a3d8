package com.work.healthcheck.core.engine;

import com.work.healthcheck.core.support.metrics.HealthcheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 根据一轮的失败数决定是否终止进程。
 * <p>
 * 两个 side 的配对互相独立，全部失败说明问题在本机；部分失败更可能是某个对端的问题，只记录不终止。
 */
public class AbortPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbortPolicy.class);

    private final int numSides;
    private final boolean abortOnError;
    private final ProcessTerminator terminator;
    private final HealthcheckMetrics metrics;

    public AbortPolicy(int numSides, boolean abortOnError, ProcessTerminator terminator, HealthcheckMetrics metrics) {
        if (numSides <= 0) {
            throw new IllegalArgumentException("numSides 必须大于0");
        }
        this.numSides = numSides;
        this.abortOnError = abortOnError;
        this.terminator = Objects.requireNonNull(terminator, "terminator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return true 表示已触发终止（仅在 terminator 被替换时才可能返回）
     */
    public boolean evaluate(RoundResult result) {
        int failures = result.getFailureCount();
        if (failures == 0) {
            return false;
        }
        if (failures < numSides) {
            LOGGER.warn("[healthcheck] round={} partial failure {}/{}, likely a peer problem: {}",
                    result.getRound(), failures, numSides, result.getOutcomes());
            return false;
        }
        LOGGER.error("[healthcheck] current host identified as problematic, round={} outcomes={}",
                result.getRound(), result.getOutcomes());
        if (!abortOnError) {
            return false;
        }
        metrics.abort();
        terminator.terminate("all " + numSides + " healthcheck channels failed in round " + result.getRound());
        return true;
    }
}
