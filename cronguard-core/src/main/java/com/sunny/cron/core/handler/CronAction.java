package com.sunny.cron.core.handler;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 进程内 Action 注解
 * <p>
 * 标记在 Spring Bean 的无参方法上，将方法注册为可在任务文件中按名称引用的 Action。
 * <p>
 * 使用示例：
 * <pre>
 * &#64;Component
 * public class SessionActions {
 *
 *     &#64;CronAction("purgeSessions")
 *     public String purgeSessions() {
 *         return "purged";
 *     }
 * }
 * </pre>
 * 任务文件中引用：
 * <pre>
 * actions:
 *   - handler: purgeSessions
 * </pre>
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CronAction {

    /**
     * Action 名称（必填，全局唯一）
     */
    String value();
}
