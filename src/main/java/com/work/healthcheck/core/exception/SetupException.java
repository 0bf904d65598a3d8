package com.work.healthcheck.core.exception;

/**
 * setup 阶段的 rendezvous / 通信组建立失败，引擎不会进入 RUNNING。
 */
public class SetupException extends HealthcheckException {

    private final int side;

    public SetupException(int side, String message) {
        super(message);
        this.side = side;
    }

    public SetupException(int side, String message, Throwable cause) {
        super(message, cause);
        this.side = side;
    }

    public int getSide() {
        return side;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
