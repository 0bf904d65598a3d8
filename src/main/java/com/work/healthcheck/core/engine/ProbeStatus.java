package com.work.healthcheck.core.engine;

public enum ProbeStatus {
    SUCCESS,
    TIMEOUT,
    FAILURE;

    public boolean isFailure() {
        return this != SUCCESS;
    }
}
