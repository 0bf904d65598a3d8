package com.work.healthcheck.core.probe;

import com.work.healthcheck.core.engine.spi.ProbeStrategy;
import com.work.healthcheck.core.topology.PairingScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 以集合通信作为探测手段：每个 side 一个 {@link ProbeChannel}，探测由 {@link ProbeRunner} 完成。
 */
public class CollectiveProbeStrategy implements ProbeStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectiveProbeStrategy.class);

    private final ProbeChannelFactory channelFactory;
    private final ProbeRunner runner;
    private final ProbeChannel[] channels = new ProbeChannel[PairingScheme.NUM_SIDES];

    public CollectiveProbeStrategy(ProbeChannelFactory channelFactory, ProbeRunner runner) {
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public int sideCount() {
        return PairingScheme.NUM_SIDES;
    }

    @Override
    public synchronized void setup(int side) {
        if (channels[side] != null) {
            throw new IllegalStateException("side " + side + " already set up");
        }
        channels[side] = channelFactory.setup(side);
    }

    @Override
    public void probe(int side) {
        ProbeChannel channel = channel(side);
        if (channel == null) {
            throw new IllegalStateException("side " + side + " has not been set up");
        }
        runner.run(channel);
    }

    /**
     * @return side 对应的 channel，未 setup 时返回 null
     */
    public synchronized ProbeChannel channel(int side) {
        return channels[side];
    }

    @Override
    public synchronized void close() {
        for (int i = 0; i < channels.length; i++) {
            if (channels[i] != null) {
                channels[i].close();
                channels[i] = null;
            }
        }
        LOGGER.debug("[healthcheck] probe channels released");
    }
}
