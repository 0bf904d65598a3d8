package com.work.healthcheck.core.config;

/**
 * 每轮探测哪些 side。
 */
public enum ProbeMode {
    /** 每轮探测所有已建立的 channel（默认）。 */
    ALL_SIDES,
    /**
     * 兼容旧行为：两个 side 都会 setup，但每轮只探测 side 0。
     * 此模式下 failureCount 最多为 1，永远达不到 abort 阈值。
     */
    FIRST_SIDE_ONLY;

    /**
     * @param sideCount 已建立的 side 数量
     * @return 本轮需要探测的 side 数量
     */
    public int probedSides(int sideCount) {
        return this == FIRST_SIDE_ONLY ? Math.min(1, sideCount) : sideCount;
    }
}
