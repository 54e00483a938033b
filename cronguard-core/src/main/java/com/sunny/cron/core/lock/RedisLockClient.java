package com.sunny.cron.core.lock;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.exception.LockTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

/**
 * 基于 Redis 的分布式锁客户端
 * <p>
 * acquire 对应一条 SET key token NX PX ttl；
 * release 使用 Lua 脚本在服务端比较并删除，返回 1 表示已释放，0 表示非本 token 持有
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class RedisLockClient implements LockClient {

    private static final Logger log = LoggerFactory.getLogger(RedisLockClient.class);

    private static final String RELEASE_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]) else return 0 end";

    private final StringRedisTemplate stringRedisTemplate;
    private final DefaultRedisScript<Long> releaseScript;

    public RedisLockClient(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = Assert.notNull(stringRedisTemplate, "StringRedisTemplate 不能为空");
        this.releaseScript = new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class);
    }

    @Override
    public boolean acquire(String key, String token, long ttlMillis) {
        Assert.positive(ttlMillis, "锁过期时间必须大于 0");
        try {
            Boolean created = stringRedisTemplate.opsForValue()
                    .setIfAbsent(key, token, Duration.ofMillis(ttlMillis));
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException ex) {
            throw new LockTransportException(ex, key, "Redis 加锁失败: key=%s", key);
        }
    }

    @Override
    public boolean release(String key, String token) {
        Long result;
        try {
            result = stringRedisTemplate.execute(releaseScript, List.of(key), token);
        } catch (DataAccessException ex) {
            throw new LockTransportException(ex, key, "Redis 解锁失败: key=%s", key);
        }
        if (result == null) {
            log.debug("解锁脚本无返回值: key={}", key);
            return false;
        }
        return result == 1L;
    }
}
