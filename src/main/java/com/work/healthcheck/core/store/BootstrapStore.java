package com.work.healthcheck.core.store;

import java.time.Duration;
import java.util.Collection;

/**
 * 用于 rendezvous 的共享 key-value 存储。仅用来引导通信组成员关系，不承载业务数据。
 * 默认实现为内存版，真实环境中使用 Redis。
 */
public interface BootstrapStore {

    void set(String key, String value);

    /**
     * 写入带过期时间的 key，过期后视为不存在。
     */
    void set(String key, String value, Duration ttl);

    /**
     * 仅在 key 不存在时写入（原子操作）。
     *
     * @return true 表示写入成功；false 表示 key 已存在，值未改变
     */
    boolean setIfAbsent(String key, String value);

    /**
     * 为已存在的 key 设置过期时间。
     *
     * @return true 表示 key 存在且已设置
     */
    boolean expire(String key, Duration ttl);

    /**
     * @return key 对应的值，不存在时返回 null
     */
    String get(String key);

    /**
     * 原子递增计数器，key 不存在时视为 0。
     *
     * @return 递增后的值
     */
    long add(String key, long delta);

    /**
     * @return true 表示 key 存在且已删除
     */
    boolean delete(String key);

    /**
     * @return 所有 key 是否都已存在
     */
    boolean check(Collection<String> keys);

    /**
     * 阻塞等待所有 key 出现。
     *
     * @return true 表示在 timeout 内全部出现
     * @throws InterruptedException 等待期间线程被中断
     */
    boolean await(Collection<String> keys, Duration timeout) throws InterruptedException;
}
