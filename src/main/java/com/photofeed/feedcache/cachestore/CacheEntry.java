package com.photofeed.feedcache.cachestore;

/**
 * 不可变缓存条目
 *
 * @param value           载荷
 * @param insertedAtNanos 写入时的 Ticker 读数
 * @param ttlNanos        存活时长
 */
public record CacheEntry(byte[] value, long insertedAtNanos, long ttlNanos) {

    /**
     * now - insertedAt == ttl 时已过期
     */
    public boolean isExpired(long nowNanos) {
        return nowNanos - insertedAtNanos >= ttlNanos;
    }

    public int weight(String key) {
        return key.length() * 2 + value.length;
    }
}
