package com.sunny.cron.core.job;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 任务注册表
 * <p>
 * 启动时加载一次，进程生命周期内不变（不支持热加载）
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class JobRegistry {

    private final Map<String, JobDefinition> jobs;
    private final String activeEnv;

    public JobRegistry(Map<String, JobDefinition> jobs, String activeEnv) {
        this.jobs = jobs == null ? Map.of() : Map.copyOf(jobs);
        this.activeEnv = activeEnv == null || activeEnv.isBlank() ? null : activeEnv.trim();
    }

    /**
     * 使用默认文件匹配规则从目录加载
     */
    public static JobRegistry load(Path directory, JobDefinitionParser parser) {
        return new JobLoader(parser).load(directory);
    }

    /**
     * 已启用的任务，每次调用返回新的 Stream
     * <p>
     * 排除 disabled 的任务，以及 env 与当前环境不一致的任务
     */
    public Stream<JobDefinition> enabledJobs() {
        return jobs.values().stream()
                .filter(job -> !job.disabled())
                .filter(job -> job.matchesEnv(activeEnv));
    }

    public Optional<JobDefinition> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public int size() {
        return jobs.size();
    }

    public Set<String> jobIds() {
        return jobs.keySet();
    }

    public String getActiveEnv() {
        return activeEnv;
    }
}
