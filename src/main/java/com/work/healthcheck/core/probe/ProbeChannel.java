package com.work.healthcheck.core.probe;

import com.work.healthcheck.core.collective.CommunicationGroup;
import com.work.healthcheck.core.collective.ExecutionContext;
import com.work.healthcheck.core.topology.PairingAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 一个 side 上已建立的通信组及其独占的执行上下文。setup 后不可变，由 HealthLoop 独占，
 * 同一时刻只会被该 side 的探测任务访问。
 */
public class ProbeChannel implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProbeChannel.class);

    private final PairingAssignment assignment;
    private final ExecutionContext executionContext;
    private final CommunicationGroup group;

    public ProbeChannel(PairingAssignment assignment, ExecutionContext executionContext, CommunicationGroup group) {
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.executionContext = Objects.requireNonNull(executionContext, "executionContext");
        this.group = Objects.requireNonNull(group, "group");
    }

    public int getSide() {
        return assignment.getSide();
    }

    public int getGroupId() {
        return assignment.getGroupId();
    }

    public int getGroupRank() {
        return assignment.getGroupRank();
    }

    public int getGroupSize() {
        return assignment.getGroupSize();
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public CommunicationGroup getGroup() {
        return group;
    }

    @Override
    public void close() {
        try {
            group.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[healthcheck] failed to close group side={}", getSide(), e);
        }
        executionContext.close();
    }

    @Override
    public String toString() {
        return "ProbeChannel{" + assignment + ", context=" + executionContext.getName() + '}';
    }
}
