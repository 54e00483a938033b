package com.sunny.cron.worker.service;

import com.sunny.cron.core.exception.ConfigurationException;
import com.sunny.cron.worker.config.CronWorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * 启动前检查共享存储连通性
 * <p>
 * Redis 不可用时直接中止启动，避免注册了触发器却每次都加锁失败
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
@Service
public class StoreConnectionVerifier {

    private static final Logger log = LoggerFactory.getLogger(StoreConnectionVerifier.class);

    private final CronWorkerProperties properties;
    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;

    public StoreConnectionVerifier(CronWorkerProperties properties,
                                   ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        this.properties = properties;
        this.redisTemplateProvider = redisTemplateProvider;
    }

    /**
     * @throws ConfigurationException Redis 未配置或无法连接
     */
    public void verify() {
        if (properties.getLockStore() != CronWorkerProperties.LockStore.REDIS) {
            return;
        }
        if (!properties.isVerifyStoreOnStartup()) {
            log.info("跳过 Redis 连通性检查");
            return;
        }
        StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            throw new ConfigurationException("未找到 StringRedisTemplate，请检查 spring.data.redis 配置");
        }
        String pong;
        try {
            pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
        } catch (DataAccessException e) {
            throw new ConfigurationException(e, "Redis 连接失败: %s", e.getMessage());
        }
        if (pong == null) {
            throw new ConfigurationException("Redis PING 无响应");
        }
        log.info("Redis 连通性检查通过: {}", pong);
    }
}
