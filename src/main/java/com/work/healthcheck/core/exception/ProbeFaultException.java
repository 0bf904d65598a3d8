package com.work.healthcheck.core.exception;

/**
 * 探测过程中的其它故障（通信错误、设备错误、store 异常等）。
 */
public class ProbeFaultException extends HealthcheckException {

    public ProbeFaultException(String message) {
        super(message);
    }

    public ProbeFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
