package com.sunny.cron.core.job;

import com.sunny.cron.core.common.Assert;
import com.sunny.cron.core.common.Constants;
import com.sunny.cron.core.exception.ConfigurationException;
import com.sunny.cron.core.exception.JobLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 任务加载器
 * <p>
 * 只扫描目录下一层的普通文件（不递归），按文件名排序后逐个解析。
 * failOnInvalid=true 时第一个不合法文件即中止加载；为 false 时记录错误并跳过该文件
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class JobLoader {

    private static final Logger log = LoggerFactory.getLogger(JobLoader.class);

    private final JobDefinitionParser parser;
    private final String filePattern;
    private final boolean failOnInvalid;
    private final String activeEnv;

    public JobLoader(JobDefinitionParser parser) {
        this(parser, Constants.DEFAULT_JOB_FILE_PATTERN, true, null);
    }

    public JobLoader(JobDefinitionParser parser, String filePattern, boolean failOnInvalid, String activeEnv) {
        this.parser = Assert.notNull(parser, "parser 不能为空");
        this.filePattern = filePattern == null || filePattern.isBlank()
                ? Constants.DEFAULT_JOB_FILE_PATTERN : filePattern;
        this.failOnInvalid = failOnInvalid;
        this.activeEnv = activeEnv;
    }

    /**
     * 从目录加载任务
     *
     * @param directory 任务目录
     * @throws ConfigurationException 目录未配置、不存在或无法读取
     * @throws JobLoadException       failOnInvalid=true 且存在不合法任务文件
     */
    public JobRegistry load(String directory) {
        if (directory == null || directory.isBlank()) {
            throw new ConfigurationException("任务目录未配置");
        }
        return load(Paths.get(directory.trim()));
    }

    public JobRegistry load(Path directory) {
        if (directory == null) {
            throw new ConfigurationException("任务目录未配置");
        }
        if (!Files.exists(directory)) {
            throw new ConfigurationException(Map.of("dir", directory.toString()), "任务目录不存在: %s", directory);
        }
        if (!Files.isDirectory(directory)) {
            throw new ConfigurationException(Map.of("dir", directory.toString()), "任务路径不是目录: %s", directory);
        }

        List<Path> files = listJobFiles(directory);
        Map<String, JobDefinition> jobs = new LinkedHashMap<>();
        int skipped = 0;
        for (Path file : files) {
            try {
                JobDefinition job = parser.parse(file);
                jobs.put(job.id(), job);
                log.debug("加载任务: id={}, schedule={}, disabled={}", job.id(), job.schedule(), job.disabled());
            } catch (JobLoadException e) {
                if (failOnInvalid) {
                    log.error("任务文件不合法，中止加载: {}", e.getMessage());
                    throw e;
                }
                skipped++;
                log.error("任务文件不合法，已跳过: {}", e.getMessage());
            }
        }

        log.info("任务加载完成: dir={}, loaded={}, skipped={}", directory, jobs.size(), skipped);
        return new JobRegistry(jobs, activeEnv);
    }

    private List<Path> listJobFiles(Path directory) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, filePattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException(e, "读取任务目录失败: %s", directory);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }
}
