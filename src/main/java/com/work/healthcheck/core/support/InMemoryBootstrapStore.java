package com.work.healthcheck.core.support;

import com.work.healthcheck.core.store.BootstrapStore;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.healthcheck.core.support.ValidationUtils.requirePositive;

/**
 * 使用 HashMap + Condition 模拟共享 store 的简单实现，供单 JVM 内多 rank 模拟与测试使用。
 * 过期时间在每次访问时惰性清理。
 */
public class InMemoryBootstrapStore implements BootstrapStore {

    private final Map<String, String> values = new HashMap<>();
    /** key -> 过期时刻（System.nanoTime） */
    private final Map<String, Long> expiries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    @Override
    public void set(String key, String value) {
        lock.lock();
        try {
            values.put(key, value);
            expiries.remove(key);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requirePositive(ttl, "ttl");
        lock.lock();
        try {
            values.put(key, value);
            expiries.put(key, System.nanoTime() + ttl.toNanos());
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        lock.lock();
        try {
            purgeExpired();
            if (values.containsKey(key)) {
                return false;
            }
            values.put(key, value);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requirePositive(ttl, "ttl");
        lock.lock();
        try {
            purgeExpired();
            if (!values.containsKey(key)) {
                return false;
            }
            expiries.put(key, System.nanoTime() + ttl.toNanos());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String get(String key) {
        lock.lock();
        try {
            purgeExpired();
            return values.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long add(String key, long delta) {
        lock.lock();
        try {
            purgeExpired();
            String current = values.get(key);
            long next = (current == null ? 0L : Long.parseLong(current)) + delta;
            values.put(key, Long.toString(next));
            changed.signalAll();
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            purgeExpired();
            expiries.remove(key);
            return values.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean check(Collection<String> keys) {
        lock.lock();
        try {
            purgeExpired();
            return values.keySet().containsAll(keys);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean await(Collection<String> keys, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            purgeExpired();
            while (!values.keySet().containsAll(keys)) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
                purgeExpired();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** @return 当前未过期的 key 数量 */
    public int size() {
        lock.lock();
        try {
            purgeExpired();
            return values.size();
        } finally {
            lock.unlock();
        }
    }

    // 调用方必须持有 lock
    private void purgeExpired() {
        if (expiries.isEmpty()) {
            return;
        }
        long now = System.nanoTime();
        Iterator<Map.Entry<String, Long>> it = expiries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> e = it.next();
            if (now - e.getValue() >= 0L) {
                values.remove(e.getKey());
                it.remove();
            }
        }
    }
}
