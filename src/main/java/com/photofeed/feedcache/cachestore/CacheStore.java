package com.photofeed.feedcache.cachestore;

import java.time.Duration;
import java.util.Optional;

/**
 * 带逐条 TTL 的 Key → 字节载荷存储
 * <p>
 * 过期条目与不存在等价；同一 Key 后写覆盖先写，条目整体替换，读方不会看到半写状态。
 * 实现必须线程安全。
 */
public interface CacheStore {

    /**
     * 读取未过期的载荷
     */
    Optional<byte[]> get(String key);

    /**
     * 写入载荷，ttl 非正时不写入
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * 删除单个 Key
     */
    void invalidate(String key);

    /**
     * 删除以 prefix 开头的全部 Key，可以多删，不能少删
     */
    void invalidatePrefix(String prefix);
}
