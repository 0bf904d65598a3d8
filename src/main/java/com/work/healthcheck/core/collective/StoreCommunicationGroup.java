package com.work.healthcheck.core.collective;

import com.work.healthcheck.core.exception.ProbeFaultException;
import com.work.healthcheck.core.store.BootstrapStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.healthcheck.core.support.ValidationUtils.requireNonNull;
import static com.work.healthcheck.core.support.ValidationUtils.requirePositive;

/**
 * 以共享 store 为传输层的参考通信组实现。
 * <p>
 * 每次 all-reduce 使用单调递增的序号 seq：
 * 1) 写入自己的贡献 allreduce/{seq}/{rank}
 * 2) 等待组内所有成员的贡献出现，按 rank 顺序求和并原地写回 payload
 * 3) 递增 allreduce/{seq}/done，最后一个读完的成员负责删除本轮的 key
 * <p>
 * 等不齐的成员删除自己的贡献后放弃；本轮所有 key 都带有 {@link #KEY_TTL_FACTOR} 倍 operationTimeout 的过期时间，
 * 中途退出的成员留下的 key 也不会一直留在 store 中。
 * <p>
 * 组内所有成员必须以相同顺序发起 all-reduce。
 */
public class StoreCommunicationGroup implements CommunicationGroup {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreCommunicationGroup.class);

    static final int KEY_TTL_FACTOR = 3;

    private final BootstrapStore store;
    private final int rank;
    private final int size;
    private final Duration operationTimeout;
    private final Duration keyTtl;
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean closed;

    StoreCommunicationGroup(BootstrapStore store, int rank, int size, Duration operationTimeout) {
        this.store = requireNonNull(store, "store");
        this.rank = rank;
        this.size = size;
        this.operationTimeout = requirePositive(operationTimeout, "operationTimeout");
        this.keyTtl = operationTimeout.multipliedBy(KEY_TTL_FACTOR);
    }

    @Override
    public int rank() {
        return rank;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ReductionWork allReduceSum(float[] payload) {
        requireNonNull(payload, "payload");
        if (closed) {
            throw new IllegalStateException("communication group is closed");
        }
        ExecutionContext context = ExecutionContextHolder.current();
        if (context == null) {
            throw new IllegalStateException("no execution context bound to " + Thread.currentThread().getName());
        }
        long seq = sequence.getAndIncrement();
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> exchange(seq, payload), context.executor());
        return new FutureReductionWork(future, "allreduce#" + seq + "@" + context.getName());
    }

    private void exchange(long seq, float[] payload) {
        String base = "allreduce/" + seq;
        String own = base + "/" + rank;
        store.set(own, encode(payload), keyTtl);

        List<String> keys = new ArrayList<>(size);
        for (int r = 0; r < size; r++) {
            keys.add(base + "/" + r);
        }
        boolean ready;
        try {
            ready = store.await(keys, operationTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            store.delete(own);
            throw new ProbeFaultException("allreduce#" + seq + " interrupted", e);
        }
        if (!ready) {
            // 撤回贡献，迟到的成员不会读到已放弃的数据
            store.delete(own);
            throw new ProbeFaultException("allreduce#" + seq + " peers missing after " + operationTimeout);
        }

        float[] sum = new float[payload.length];
        for (String key : keys) {
            float[] contribution = decode(store.get(key), payload.length);
            for (int i = 0; i < sum.length; i++) {
                sum[i] += contribution[i];
            }
        }
        System.arraycopy(sum, 0, payload, 0, payload.length);

        long done = store.add(base + "/done", 1L);
        if (done == 1L) {
            store.expire(base + "/done", keyTtl);
        }
        if (done == size) {
            for (String key : keys) {
                store.delete(key);
            }
            store.delete(base + "/done");
            LOGGER.trace("[healthcheck] allreduce#{} keys released by rank={}", seq, rank);
        }
    }

    static String encode(float[] values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(values[i]);
        }
        return sb.toString();
    }

    static float[] decode(String encoded, int expectedLength) {
        if (encoded == null) {
            throw new ProbeFaultException("contribution vanished from store");
        }
        String[] parts = encoded.split(",");
        if (parts.length != expectedLength) {
            throw new ProbeFaultException("contribution length mismatch: expected=" + expectedLength + ", actual=" + parts.length);
        }
        float[] out = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                out[i] = Float.parseFloat(parts[i]);
            }
        } catch (NumberFormatException e) {
            throw new ProbeFaultException("malformed contribution: " + encoded, e);
        }
        return out;
    }

    @Override
    public void close() {
        closed = true;
    }
}
