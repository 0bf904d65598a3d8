package com.work.healthcheck.core.exception;

/**
 * all-reduce 返回值与期望值不一致（例如某个成员贡献了错误的数据）。
 */
public class DataIntegrityException extends HealthcheckException {

    private final double expected;
    private final double actual;

    public DataIntegrityException(double expected, double actual) {
        super("Health check all reduce returned invalid results: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public double getExpected() {
        return expected;
    }

    public double getActual() {
        return actual;
    }
}
