package com.work.healthcheck.core.engine;

/**
 * 单个 channel 在一轮中的探测结果。
 */
public class ProbeOutcome {

    private final int side;
    private final ProbeStatus status;
    private final String reason;

    private ProbeOutcome(int side, ProbeStatus status, String reason) {
        this.side = side;
        this.status = status;
        this.reason = reason;
    }

    public static ProbeOutcome success(int side) {
        return new ProbeOutcome(side, ProbeStatus.SUCCESS, null);
    }

    public static ProbeOutcome timeout(int side) {
        return new ProbeOutcome(side, ProbeStatus.TIMEOUT, "timed out");
    }

    public static ProbeOutcome failure(int side, Throwable cause) {
        String reason = cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new ProbeOutcome(side, ProbeStatus.FAILURE, reason);
    }

    public int getSide() {
        return side;
    }

    public ProbeStatus getStatus() {
        return status;
    }

    /** @return 失败原因，成功时为 null */
    public String getReason() {
        return reason;
    }

    public boolean isFailure() {
        return status.isFailure();
    }

    @Override
    public String toString() {
        return reason == null ? "side" + side + "=" + status : "side" + side + "=" + status + "(" + reason + ")";
    }
}
