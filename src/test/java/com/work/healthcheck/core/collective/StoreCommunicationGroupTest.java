package com.work.healthcheck.core.collective;

import com.work.healthcheck.core.exception.HealthcheckException;
import com.work.healthcheck.core.exception.ProbeFaultException;
import com.work.healthcheck.core.exception.ProbeTimeoutException;
import com.work.healthcheck.core.store.BootstrapStore;
import com.work.healthcheck.core.store.PrefixBootstrapStore;
import com.work.healthcheck.core.support.InMemoryBootstrapStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class StoreCommunicationGroupTest {

    private static StoreCommunicationGroupFactory factory(String nodeId, Duration setupTimeout) {
        return new StoreCommunicationGroupFactory(() -> nodeId, setupTimeout, Duration.ofSeconds(5));
    }

    @Test
    public void four_members_sum_their_contributions_and_release_keys() throws Exception {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        int size = 4;
        ExecutorService pool = Executors.newFixedThreadPool(size);
        try {
            List<Future<float[]>> results = new ArrayList<>();
            for (int r = 0; r < size; r++) {
                final int rank = r;
                results.add(pool.submit(() -> {
                    PrefixBootstrapStore store = new PrefixBootstrapStore("/healthcheck/0/0", shared);
                    CommunicationGroup group = factory("node-" + rank, Duration.ofSeconds(5)).connect(store, rank, size);
                    DedicatedExecutionContext context = DedicatedExecutionContext.forSide(0);
                    try (ExecutionContext.Binding ignored = context.bind()) {
                        float[] payload = new float[]{1.0f, rank};
                        group.allReduceSum(payload).await(Duration.ofSeconds(5));
                        return payload;
                    } finally {
                        context.close();
                        group.close();
                    }
                }));
            }
            for (Future<float[]> f : results) {
                float[] out = f.get(10, TimeUnit.SECONDS);
                assertEquals(4.0f, out[0]);
                assertEquals(6.0f, out[1]);
            }
        } finally {
            pool.shutdownNow();
        }
        // 只剩成员登记
        assertEquals(size, shared.size());
    }

    @Test
    public void rendezvous_fails_when_peer_never_shows_up() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        HealthcheckException ex = assertThrows(HealthcheckException.class,
                () -> factory("node-0", Duration.ofMillis(50)).connect(shared, 0, 2));
        assertTrue(ex.getMessage().contains("rendezvous timed out"));
    }

    @Test
    public void rendezvous_rejects_rank_claimed_by_other_node() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        shared.set("member/0", "someone-else");
        assertThrows(HealthcheckException.class,
                () -> factory("node-0", Duration.ofMillis(50)).connect(shared, 0, 2));
    }

    @Test
    public void all_reduce_requires_bound_execution_context() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        StoreCommunicationGroup group = new StoreCommunicationGroup(shared, 0, 1, Duration.ofSeconds(1));
        assertThrows(IllegalStateException.class, () -> group.allReduceSum(new float[]{1.0f}));
    }

    @Test
    public void missing_peer_contribution_times_out_then_faults() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        StoreCommunicationGroup group = new StoreCommunicationGroup(shared, 0, 2, Duration.ofMillis(200));
        DedicatedExecutionContext context = DedicatedExecutionContext.forSide(1);
        try (ExecutionContext.Binding ignored = context.bind()) {
            ReductionWork work = group.allReduceSum(new float[]{1.0f});
            assertThrows(ProbeTimeoutException.class, () -> work.await(Duration.ofMillis(20)));
            assertFalse(work.isCompleted());
            assertThrows(ProbeFaultException.class, () -> work.await(Duration.ofSeconds(2)));
        } finally {
            context.close();
        }
        assertNull(ExecutionContextHolder.current());
    }

    @Test
    public void abandoned_rounds_do_not_leave_keys_behind() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        StoreCommunicationGroup early = new StoreCommunicationGroup(shared, 0, 2, Duration.ofMillis(50));
        StoreCommunicationGroup late = new StoreCommunicationGroup(shared, 1, 2, Duration.ofMillis(50));
        DedicatedExecutionContext context = DedicatedExecutionContext.forSide(0);
        try (ExecutionContext.Binding ignored = context.bind()) {
            for (int round = 0; round < 5; round++) {
                // 两个成员错开到达，各自等不齐后放弃
                ReductionWork first = early.allReduceSum(new float[]{1.0f});
                assertThrows(ProbeFaultException.class, () -> first.await(Duration.ofSeconds(2)));
                float[] payload = new float[]{1.0f};
                ReductionWork second = late.allReduceSum(payload);
                assertThrows(ProbeFaultException.class, () -> second.await(Duration.ofSeconds(2)));
                assertEquals(0, shared.size(), "round=" + round);
            }
        } finally {
            context.close();
        }
    }

    @Test
    public void round_keys_are_written_with_expiry() throws Exception {
        BootstrapStore store = mock(BootstrapStore.class);
        when(store.await(anyCollection(), any(Duration.class))).thenReturn(true);
        when(store.get(anyString())).thenReturn("1.0");
        when(store.add(eq("allreduce/0/done"), eq(1L))).thenReturn(1L);

        StoreCommunicationGroup group = new StoreCommunicationGroup(store, 0, 2, Duration.ofSeconds(1));
        Duration ttl = Duration.ofSeconds(1).multipliedBy(StoreCommunicationGroup.KEY_TTL_FACTOR);
        DedicatedExecutionContext context = DedicatedExecutionContext.forSide(0);
        try (ExecutionContext.Binding ignored = context.bind()) {
            float[] payload = new float[]{1.0f};
            group.allReduceSum(payload).await(Duration.ofSeconds(2));
            assertEquals(2.0f, payload[0]);
        } finally {
            context.close();
        }
        verify(store).set(eq("allreduce/0/0"), eq("1.0"), eq(ttl));
        verify(store).expire(eq("allreduce/0/done"), eq(ttl));
        verify(store, never()).set(anyString(), anyString());
    }

    @Test
    public void concurrent_claims_on_one_rank_admit_a_single_node() throws Exception {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<Boolean>> claims = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                final String nodeId = "node-" + i;
                claims.add(pool.submit(() -> {
                    try {
                        // size=1：登记成功即完成 rendezvous
                        factory(nodeId, Duration.ofMillis(200)).connect(shared, 0, 1).close();
                        return true;
                    } catch (HealthcheckException e) {
                        assertTrue(e.getMessage().contains("already claimed"));
                        return false;
                    }
                }));
            }
            int admitted = 0;
            for (Future<Boolean> claim : claims) {
                if (claim.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(1, admitted);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void same_node_may_reclaim_its_rank() {
        InMemoryBootstrapStore shared = new InMemoryBootstrapStore();
        shared.set("member/0", "node-0");
        factory("node-0", Duration.ofMillis(50)).connect(shared, 0, 1).close();
        assertEquals("node-0", shared.get("member/0"));
    }

    @Test
    public void decode_rejects_malformed_contribution() {
        assertThrows(ProbeFaultException.class, () -> StoreCommunicationGroup.decode("1.0,x", 2));
        assertThrows(ProbeFaultException.class, () -> StoreCommunicationGroup.decode("1.0", 2));
        assertThrows(ProbeFaultException.class, () -> StoreCommunicationGroup.decode(null, 1));
        assertArrayEquals(new float[]{1.5f, 2.0f}, StoreCommunicationGroup.decode(StoreCommunicationGroup.encode(new float[]{1.5f, 2.0f}), 2));
    }
}
