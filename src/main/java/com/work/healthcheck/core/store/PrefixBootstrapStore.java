package com.work.healthcheck.core.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.work.healthcheck.core.support.ValidationUtils.requireNonEmpty;
import static com.work.healthcheck.core.support.ValidationUtils.requireNonNull;

/**
 * 带命名空间前缀的 store 视图：所有 key 改写为 {@code prefix + "/" + key}。
 */
public class PrefixBootstrapStore implements BootstrapStore {

    private final String prefix;
    private final BootstrapStore delegate;

    public PrefixBootstrapStore(String prefix, BootstrapStore delegate) {
        this.prefix = requireNonEmpty(prefix, "prefix");
        this.delegate = requireNonNull(delegate, "delegate");
    }

    public String getPrefix() {
        return prefix;
    }

    private String join(String key) {
        return prefix + "/" + key;
    }

    private List<String> joinAll(Collection<String> keys) {
        List<String> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            out.add(join(key));
        }
        return out;
    }

    @Override
    public void set(String key, String value) {
        delegate.set(join(key), value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        delegate.set(join(key), value, ttl);
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        return delegate.setIfAbsent(join(key), value);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return delegate.expire(join(key), ttl);
    }

    @Override
    public String get(String key) {
        return delegate.get(join(key));
    }

    @Override
    public long add(String key, long delta) {
        return delegate.add(join(key), delta);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(join(key));
    }

    @Override
    public boolean check(Collection<String> keys) {
        return delegate.check(joinAll(keys));
    }

    @Override
    public boolean await(Collection<String> keys, Duration timeout) throws InterruptedException {
        return delegate.await(joinAll(keys), timeout);
    }
}
