package com.work.healthcheck.core.collective;

import com.work.healthcheck.core.exception.HealthcheckException;
import com.work.healthcheck.core.store.BootstrapStore;
import com.work.healthcheck.core.support.NodeIdProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.work.healthcheck.core.support.ValidationUtils.requireNonNull;
import static com.work.healthcheck.core.support.ValidationUtils.requirePositive;

/**
 * 通过 store 完成成员 rendezvous，并创建 {@link StoreCommunicationGroup}。
 */
public class StoreCommunicationGroupFactory implements CommunicationGroupFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreCommunicationGroupFactory.class);

    private final NodeIdProvider nodeIdProvider;
    private final Duration setupTimeout;
    private final Duration operationTimeout;

    public StoreCommunicationGroupFactory(NodeIdProvider nodeIdProvider, Duration setupTimeout, Duration operationTimeout) {
        this.nodeIdProvider = requireNonNull(nodeIdProvider, "nodeIdProvider");
        this.setupTimeout = requirePositive(setupTimeout, "setupTimeout");
        this.operationTimeout = requirePositive(operationTimeout, "operationTimeout");
    }

    @Override
    public CommunicationGroup connect(BootstrapStore store, int groupRank, int groupSize) {
        requireNonNull(store, "store");
        if (groupSize <= 0 || groupRank < 0 || groupRank >= groupSize) {
            throw new IllegalArgumentException("invalid group rank " + groupRank + " for size " + groupSize);
        }
        String self = "member/" + groupRank;
        String nodeId = nodeIdProvider.getNodeId();
        if (!store.setIfAbsent(self, nodeId)) {
            String existing = store.get(self);
            // 同一节点重复 setup 时允许复用自己的登记
            if (!nodeId.equals(existing)) {
                throw new HealthcheckException("group rank " + groupRank + " already claimed by " + existing);
            }
        }

        List<String> members = new ArrayList<>(groupSize);
        for (int r = 0; r < groupSize; r++) {
            members.add("member/" + r);
        }
        boolean ready;
        try {
            ready = store.await(members, setupTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HealthcheckException("rendezvous interrupted", e);
        }
        if (!ready) {
            throw new HealthcheckException("rendezvous timed out after " + setupTimeout
                    + " waiting for " + groupSize + " members");
        }
        LOGGER.debug("[healthcheck] rendezvous complete rank={} size={}", groupRank, groupSize);
        return new StoreCommunicationGroup(store, groupRank, groupSize, operationTimeout);
    }
}
