package com.work.healthcheck.core.store.impl;

import com.work.healthcheck.core.exception.HealthcheckException;
import com.work.healthcheck.core.store.BootstrapStore;
import com.work.healthcheck.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collection;

import static com.work.healthcheck.core.support.ValidationUtils.requireNonEmpty;
import static com.work.healthcheck.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的共享 store 实现
 *
 * 特性：
 * 1. 所有 key 挂在 namespace 下，不同作业运行互不干扰
 * 2. add 使用 INCRBY，保证计数原子性
 * 3. Redis 没有阻塞等待 key 的原语，await 以固定间隔轮询
 * 4. setIfAbsent 使用 SET NX，成员登记不会被并发覆盖
 */
public class RedisBootstrapStore implements BootstrapStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisBootstrapStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String namespace;
    private final Duration pollInterval;

    public RedisBootstrapStore(StringRedisTemplate redisTemplate, String namespace, Duration pollInterval) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
        this.namespace = requireNonEmpty(namespace, "namespace");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
    }

    private String key(String key) {
        return namespace + ":" + key;
    }

    @Override
    public void set(String key, String value) {
        try {
            redisTemplate.opsForValue().set(key(key), value);
        } catch (Exception e) {
            throw new HealthcheckException("Redis set 异常: " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requirePositive(ttl, "ttl");
        try {
            redisTemplate.opsForValue().set(key(key), value, ttl);
        } catch (Exception e) {
            throw new HealthcheckException("Redis set 异常: " + key, e);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        try {
            // SET key value NX
            Boolean result = redisTemplate.opsForValue().setIfAbsent(key(key), value);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new HealthcheckException("Redis setIfAbsent 异常: " + key, e);
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requirePositive(ttl, "ttl");
        try {
            return Boolean.TRUE.equals(redisTemplate.expire(key(key), ttl));
        } catch (Exception e) {
            throw new HealthcheckException("Redis expire 异常: " + key, e);
        }
    }

    @Override
    public String get(String key) {
        try {
            return redisTemplate.opsForValue().get(key(key));
        } catch (Exception e) {
            throw new HealthcheckException("Redis get 异常: " + key, e);
        }
    }

    @Override
    public long add(String key, long delta) {
        try {
            Long result = redisTemplate.opsForValue().increment(key(key), delta);
            if (result == null) {
                // pipeline/事务模式下才会返回 null
                throw new HealthcheckException("Redis increment 返回空: " + key);
            }
            return result;
        } catch (HealthcheckException e) {
            throw e;
        } catch (Exception e) {
            throw new HealthcheckException("Redis increment 异常: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key(key)));
        } catch (Exception e) {
            throw new HealthcheckException("Redis delete 异常: " + key, e);
        }
    }

    @Override
    public boolean check(Collection<String> keys) {
        for (String k : keys) {
            Boolean exists;
            try {
                exists = redisTemplate.hasKey(key(k));
            } catch (Exception e) {
                throw new HealthcheckException("Redis exists 异常: " + k, e);
            }
            if (!Boolean.TRUE.equals(exists)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean await(Collection<String> keys, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (check(keys)) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                LOGGER.debug("[healthcheck] await timed out, namespace={}, keys={}", namespace, keys);
                return false;
            }
            Thread.sleep(Math.max(1L, Math.min(pollInterval.toMillis(), remaining / 1_000_000L)));
        }
    }
}
