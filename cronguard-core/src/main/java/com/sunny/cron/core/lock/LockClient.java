package com.sunny.cron.core.lock;

/**
 * 分布式锁客户端
 * <p>
 * 两个操作都必须是共享存储上的单次原子操作：
 * <ul>
 *     <li>acquire：key 不存在时写入 token 并设置过期时间</li>
 *     <li>release：key 的当前值等于 token 时删除</li>
 * </ul>
 * 与存储通信失败时抛出 {@link com.sunny.cron.core.exception.LockTransportException}
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public interface LockClient {

    /**
     * 尝试加锁
     *
     * @param key       锁 Key
     * @param token     本次加锁的 fencing token
     * @param ttlMillis 锁过期时间（毫秒）
     * @return true 加锁成功，false 锁已被其他持有者占用
     */
    boolean acquire(String key, String token, long ttlMillis);

    /**
     * 释放锁，仅当存储中的值等于 token 时删除
     *
     * @param key   锁 Key
     * @param token 加锁时写入的 token
     * @return true 已释放，false 锁已过期或属于其他持有者，Key 保持不变
     */
    boolean release(String key, String token);
}
