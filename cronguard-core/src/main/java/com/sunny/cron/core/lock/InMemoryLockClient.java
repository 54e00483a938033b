package com.sunny.cron.core.lock;

import com.sunny.cron.core.common.Assert;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * 进程内锁客户端
 * <p>
 * 与 {@link RedisLockClient} 语义一致（NX + 过期时间、比较后删除），
 * 用于单机部署（lock-store=memory）以及多个调度器共享同一存储的测试场景
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public class InMemoryLockClient implements LockClient {

    private final Clock clock;

    /**
     * key -> 锁记录，所有访问都在 this 上同步
     */
    private final Map<String, LockEntry> entries = new HashMap<>();

    public InMemoryLockClient() {
        this(Clock.systemUTC());
    }

    public InMemoryLockClient(Clock clock) {
        this.clock = Assert.notNull(clock, "clock 不能为空");
    }

    @Override
    public synchronized boolean acquire(String key, String token, long ttlMillis) {
        Assert.positive(ttlMillis, "锁过期时间必须大于 0");
        long now = clock.millis();
        LockEntry current = entries.get(key);
        if (current != null && !current.isExpired(now)) {
            return false;
        }
        entries.put(key, new LockEntry(token, now + ttlMillis));
        return true;
    }

    @Override
    public synchronized boolean release(String key, String token) {
        LockEntry current = entries.get(key);
        if (current == null || current.isExpired(clock.millis())) {
            entries.remove(key);
            return false;
        }
        if (!current.token().equals(token)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    /**
     * 查询当前持有者 token，已过期或不存在返回 null
     */
    public synchronized String currentToken(String key) {
        LockEntry current = entries.get(key);
        if (current == null || current.isExpired(clock.millis())) {
            return null;
        }
        return current.token();
    }

    private record LockEntry(String token, long expiresAtMillis) {

        boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }
}
