package com.work.healthcheck.core.topology;

import com.work.healthcheck.core.exception.ConfigurationException;

/**
 * 按主机粒度把当前 rank 与相邻主机配对。
 * <p>
 * side 0 与 side 1 给出两种不同的相邻主机配对，两个 side 合起来每台主机会与左右两个邻居各测一次：
 * 两个 side 同时失败说明是本机的问题，只有一侧失败更可能是对端的问题。
 * <p>
 * 无状态，线程安全。
 */
public class PairingScheme {

    public static final int NUM_SIDES = 2;

    private final int rank;
    private final int worldSize;
    private final int localWorldSize;

    public PairingScheme(int rank, int worldSize, int localWorldSize) {
        if (localWorldSize <= 0) {
            throw new ConfigurationException("Local world size must be positive");
        }
        if (rank < 0) {
            throw new ConfigurationException("Rank must be non-negative");
        }
        if (worldSize % localWorldSize != 0) {
            throw new ConfigurationException("World size must be divisible by local world size");
        }
        if (rank >= worldSize) {
            throw new ConfigurationException("Rank must be less than world size");
        }
        if (worldSize / localWorldSize < 2) {
            throw new ConfigurationException("At least two hosts are required");
        }
        this.rank = rank;
        this.worldSize = worldSize;
        this.localWorldSize = localWorldSize;
    }

    /**
     * 计算指定 side 上的配对。
     *
     * @param side 0 或 1
     * @return 组号、组内 rank 与组大小
     */
    public PairingAssignment assign(int side) {
        if (side < 0 || side >= NUM_SIDES) {
            throw new IllegalArgumentException("side must be in [0, " + NUM_SIDES + "), got " + side);
        }
        int hostRank = rank / localWorldSize;
        int hostCount = worldSize / localWorldSize;

        int groupId = ((hostRank + side) % hostCount) / 2;
        int groupSize = 2 * localWorldSize;
        int groupRank = rank % groupSize;
        return new PairingAssignment(side, groupId, groupRank, groupSize, hostRank, hostCount);
    }

    public int getRank() {
        return rank;
    }

    public int getWorldSize() {
        return worldSize;
    }

    public int getLocalWorldSize() {
        return localWorldSize;
    }
}
