package com.work.healthcheck.core.probe;

import com.work.healthcheck.core.collective.CommunicationGroup;
import com.work.healthcheck.core.collective.CommunicationGroupFactory;
import com.work.healthcheck.core.collective.ExecutionContext;
import com.work.healthcheck.core.collective.ExecutionContextFactory;
import com.work.healthcheck.core.exception.SetupException;
import com.work.healthcheck.core.store.BootstrapStore;
import com.work.healthcheck.core.store.PrefixBootstrapStore;
import com.work.healthcheck.core.topology.PairingAssignment;
import com.work.healthcheck.core.topology.PairingScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * setup(side)：计算配对 → 命名空间 store → 独占执行上下文 → 阻塞建立通信组。
 */
public class ProbeChannelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProbeChannelFactory.class);

    private final PairingScheme pairingScheme;
    private final BootstrapStore store;
    private final ExecutionContextFactory contextFactory;
    private final CommunicationGroupFactory groupFactory;

    public ProbeChannelFactory(PairingScheme pairingScheme,
                               BootstrapStore store,
                               ExecutionContextFactory contextFactory,
                               CommunicationGroupFactory groupFactory) {
        this.pairingScheme = Objects.requireNonNull(pairingScheme, "pairingScheme");
        this.store = Objects.requireNonNull(store, "store");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
        this.groupFactory = Objects.requireNonNull(groupFactory, "groupFactory");
    }

    /**
     * 建立 side 对应的 channel。任何失败都包装为 {@link SetupException}，且不会泄漏已分配的上下文。
     */
    public ProbeChannel setup(int side) {
        PairingAssignment assignment = pairingScheme.assign(side);
        PrefixBootstrapStore scoped = new PrefixBootstrapStore(assignment.storePrefix(), store);

        LOGGER.info("[healthcheck] creating group for side={}, group={}, rank={}, size={}, store={}",
                side, assignment.getGroupId(), assignment.getGroupRank(), assignment.getGroupSize(),
                scoped.getPrefix());

        ExecutionContext context;
        try {
            context = contextFactory.create(side);
        } catch (RuntimeException e) {
            throw new SetupException(side, "failed to allocate execution context for side " + side, e);
        }
        try {
            CommunicationGroup group = groupFactory.connect(scoped, assignment.getGroupRank(), assignment.getGroupSize());
            return new ProbeChannel(assignment, context, group);
        } catch (RuntimeException e) {
            context.close();
            if (e instanceof SetupException) {
                throw e;
            }
            throw new SetupException(side, "failed to establish group for side " + side
                    + " (" + scoped.getPrefix() + "): " + e.getMessage(), e);
        }
    }
}
