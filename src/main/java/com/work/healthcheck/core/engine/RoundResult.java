package com.work.healthcheck.core.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一轮探测的汇总：按 side 顺序排列的结果以及失败数。
 */
public class RoundResult {

    private final long round;
    private final Instant startedAt;
    private final List<ProbeOutcome> outcomes;
    private final int failureCount;

    public RoundResult(long round, Instant startedAt, List<ProbeOutcome> outcomes) {
        this.round = round;
        this.startedAt = startedAt;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        int failures = 0;
        for (ProbeOutcome outcome : outcomes) {
            if (outcome.isFailure()) {
                failures++;
            }
        }
        this.failureCount = failures;
    }

    public long getRound() {
        return round;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public List<ProbeOutcome> getOutcomes() {
        return outcomes;
    }

    public int getFailureCount() {
        return failureCount;
    }

    @Override
    public String toString() {
        return "RoundResult{round=" + round + ", failures=" + failureCount + ", outcomes=" + outcomes + '}';
    }
}
