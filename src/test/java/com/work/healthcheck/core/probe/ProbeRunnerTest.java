package com.work.healthcheck.core.probe;

import com.work.healthcheck.core.collective.CommunicationGroup;
import com.work.healthcheck.core.collective.DedicatedExecutionContext;
import com.work.healthcheck.core.collective.ExecutionContext;
import com.work.healthcheck.core.collective.ExecutionContextHolder;
import com.work.healthcheck.core.collective.ReductionWork;
import com.work.healthcheck.core.exception.DataIntegrityException;
import com.work.healthcheck.core.exception.ProbeFaultException;
import com.work.healthcheck.core.exception.ProbeTimeoutException;
import com.work.healthcheck.core.topology.PairingScheme;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ProbeRunnerTest {

    private final ExecutionContext context = mock(ExecutionContext.class);
    private final CommunicationGroup group = mock(CommunicationGroup.class);
    private final ReductionWork work = mock(ReductionWork.class);

    private ProbeChannel channel(float reducedValue) {
        when(context.getName()).thenReturn("healthcheck-stream-0");
        when(context.bind()).thenReturn(() -> { });
        when(group.allReduceSum(any(float[].class))).thenAnswer(inv -> {
            float[] payload = inv.getArgument(0);
            assertEquals(1.0f, payload[0]);
            assertEquals(1, payload.length);
            payload[0] = reducedValue;
            return work;
        });
        return new ProbeChannel(new PairingScheme(5, 16, 4).assign(0), context, group);
    }

    @Test
    public void expected_sum_passes() {
        ProbeRunner runner = new ProbeRunner(Duration.ofSeconds(1), 4);
        runner.run(channel(8.0f));

        verify(context, times(1)).bind();
        verify(work, times(1)).await(eq(Duration.ofSeconds(1)));
    }

    @Test
    public void wrong_sum_is_data_integrity_error() {
        ProbeRunner runner = new ProbeRunner(Duration.ofSeconds(1), 4);
        DataIntegrityException ex = assertThrows(DataIntegrityException.class, () -> runner.run(channel(7.0f)));
        assertEquals(8.0, ex.getExpected());
        assertEquals(7.0, ex.getActual());
        assertFalse(ex.isFatal());
    }

    @Test
    public void wait_timeout_propagates_as_probe_timeout() {
        ProbeRunner runner = new ProbeRunner(Duration.ofMillis(10), 4);
        ProbeChannel channel = channel(8.0f);
        doThrow(new ProbeTimeoutException("slow", Duration.ofMillis(10))).when(work).await(any(Duration.class));
        assertThrows(ProbeTimeoutException.class, () -> runner.run(channel));
    }

    @Test
    public void unexpected_runtime_failure_is_probe_fault() {
        ProbeRunner runner = new ProbeRunner(Duration.ofSeconds(1), 1);
        when(context.getName()).thenReturn("ctx");
        when(context.bind()).thenReturn(() -> { });
        when(group.allReduceSum(any(float[].class))).thenThrow(new IllegalStateException("communicator aborted"));
        ProbeChannel channel = new ProbeChannel(new PairingScheme(0, 2, 1).assign(1), context, group);

        ProbeFaultException ex = assertThrows(ProbeFaultException.class, () -> runner.run(channel));
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    public void binding_is_released_even_when_probe_fails() {
        ExecutionContext.Binding binding = mock(ExecutionContext.Binding.class);
        when(context.getName()).thenReturn("ctx");
        when(context.bind()).thenReturn(binding);
        when(group.allReduceSum(any(float[].class))).thenThrow(new IllegalStateException("boom"));
        ProbeChannel channel = new ProbeChannel(new PairingScheme(0, 2, 1).assign(0), context, group);

        assertThrows(ProbeFaultException.class, () -> new ProbeRunner(Duration.ofSeconds(1), 1).run(channel));
        verify(binding, times(1)).close();
    }

    @Test
    public void group_sees_channel_context_as_current() {
        AtomicReference<ExecutionContext> seen = new AtomicReference<>();
        DedicatedExecutionContext real = DedicatedExecutionContext.forSide(0);
        try {
            when(group.allReduceSum(any(float[].class))).thenAnswer(inv -> {
                seen.set(ExecutionContextHolder.current());
                float[] payload = inv.getArgument(0);
                payload[0] = 2.0f;
                return work;
            });
            ProbeChannel channel = new ProbeChannel(new PairingScheme(0, 2, 1).assign(0), real, group);
            new ProbeRunner(Duration.ofSeconds(1), 1).run(channel);
            assertSame(real, seen.get());
            assertNull(ExecutionContextHolder.current());
        } finally {
            real.close();
        }
    }
}
