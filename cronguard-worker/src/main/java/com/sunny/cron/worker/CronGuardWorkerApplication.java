package com.sunny.cron.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * CronGuard Worker 启动类
 * <p>
 * Worker 职责：
 * - 启动时从任务目录加载任务定义，为每个启用的任务注册 cron 触发器
 * - 每次触发先在 Redis 上加锁，保证同一 tick 只有一个 Worker 执行
 * - 多个 Worker 完全对等，不做选主
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@SpringBootApplication
@ComponentScan(basePackages = {"com.sunny.cron.worker", "com.sunny.cron.core.handler"})
public class CronGuardWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronGuardWorkerApplication.class, args);
    }
}
