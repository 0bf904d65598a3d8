package com.work.healthcheck.core.store.impl;

import com.work.healthcheck.core.exception.HealthcheckException;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RedisBootstrapStoreTest {

    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> ops = mock(ValueOperations.class);
    private final StringRedisTemplate template = mock(StringRedisTemplate.class);

    private RedisBootstrapStore store() {
        when(template.opsForValue()).thenReturn(ops);
        return new RedisBootstrapStore(template, "run1", Duration.ofMillis(5));
    }

    @Test
    public void keys_are_namespaced() {
        RedisBootstrapStore store = store();
        store.set("/healthcheck/0/0/member/1", "node");
        verify(ops).set(eq("run1:/healthcheck/0/0/member/1"), eq("node"));

        when(ops.increment(eq("run1:c"), eq(1L))).thenReturn(2L);
        assertEquals(2L, store.add("c", 1L));

        when(template.delete(eq("run1:c"))).thenReturn(Boolean.TRUE);
        assertTrue(store.delete("c"));
    }

    @Test
    public void await_polls_until_all_keys_exist() throws Exception {
        RedisBootstrapStore store = store();
        when(template.hasKey(eq("run1:a"))).thenReturn(Boolean.TRUE);
        when(template.hasKey(eq("run1:b"))).thenReturn(Boolean.FALSE, Boolean.FALSE, Boolean.TRUE);

        assertTrue(store.await(Arrays.asList("a", "b"), Duration.ofSeconds(2)));
        verify(template, atLeast(3)).hasKey(eq("run1:b"));
    }

    @Test
    public void await_gives_up_at_deadline() throws Exception {
        RedisBootstrapStore store = store();
        when(template.hasKey(anyString())).thenReturn(Boolean.FALSE);
        assertFalse(store.await(Arrays.asList("a"), Duration.ofMillis(30)));
    }

    @Test
    public void ttl_and_claims_map_to_redis_primitives() {
        RedisBootstrapStore store = store();
        store.set("allreduce/0/1", "1.0", Duration.ofSeconds(3));
        verify(ops).set(eq("run1:allreduce/0/1"), eq("1.0"), eq(Duration.ofSeconds(3)));

        when(template.expire(eq("run1:allreduce/0/done"), eq(Duration.ofSeconds(3)))).thenReturn(Boolean.TRUE);
        assertTrue(store.expire("allreduce/0/done", Duration.ofSeconds(3)));

        when(ops.setIfAbsent(eq("run1:member/0"), eq("node-a"))).thenReturn(Boolean.TRUE);
        when(ops.setIfAbsent(eq("run1:member/0"), eq("node-b"))).thenReturn(Boolean.FALSE);
        assertTrue(store.setIfAbsent("member/0", "node-a"));
        assertFalse(store.setIfAbsent("member/0", "node-b"));
    }

    @Test
    public void redis_failures_are_wrapped() {
        RedisBootstrapStore store = store();
        when(ops.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        HealthcheckException ex = assertThrows(HealthcheckException.class, () -> store.get("k"));
        assertTrue(ex.getCause() instanceof RedisConnectionFailureException);
    }
}
