package com.work.healthcheck.core.topology;

/**
 * 某个 rank 在某个 side 上的配对结果。
 */
public class PairingAssignment {

    private final int side;
    private final int groupId;
    private final int groupRank;
    private final int groupSize;
    private final int hostRank;
    private final int hostCount;

    public PairingAssignment(int side, int groupId, int groupRank, int groupSize, int hostRank, int hostCount) {
        this.side = side;
        this.groupId = groupId;
        this.groupRank = groupRank;
        this.groupSize = groupSize;
        this.hostRank = hostRank;
        this.hostCount = hostCount;
    }

    public int getSide() {
        return side;
    }

    public int getGroupId() {
        return groupId;
    }

    public int getGroupRank() {
        return groupRank;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public int getHostRank() {
        return hostRank;
    }

    public int getHostCount() {
        return hostCount;
    }

    /**
     * rendezvous 命名空间，(side, groupId) 唯一，避免不相关的配对互相连上。
     */
    public String storePrefix() {
        return "/healthcheck/" + side + "/" + groupId;
    }

    @Override
    public String toString() {
        return "PairingAssignment{side=" + side
                + ", group=" + groupId
                + ", rank=" + groupRank
                + ", size=" + groupSize
                + ", host=" + hostRank + "/" + hostCount + '}';
    }
}
