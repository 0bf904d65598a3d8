package com.work.healthcheck.core.collective;

import com.work.healthcheck.core.exception.HealthcheckException;
import com.work.healthcheck.core.exception.ProbeFaultException;
import com.work.healthcheck.core.exception.ProbeTimeoutException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 以 CompletableFuture 承载的 {@link ReductionWork}。
 */
public class FutureReductionWork implements ReductionWork {

    private final CompletableFuture<?> future;
    private final String description;

    public FutureReductionWork(CompletableFuture<?> future, String description) {
        this.future = future;
        this.description = description;
    }

    @Override
    public void await(Duration timeout) {
        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new ProbeTimeoutException(description + " did not complete within " + timeout, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeFaultException(description + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HealthcheckException) {
                throw (HealthcheckException) cause;
            }
            throw new ProbeFaultException(description + " failed: " + cause, cause);
        }
    }

    @Override
    public boolean isCompleted() {
        return future.isDone();
    }
}
