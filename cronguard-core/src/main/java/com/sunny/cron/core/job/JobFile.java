package com.sunny.cron.core.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 任务文件结构（反序列化用）
 * <p>
 * actions 保留原始节点，由 {@link JobDefinitionParser} 逐项校验
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public record JobFile(String schedule,
                      Long duration,
                      Boolean disabled,
                      String env,
                      List<JsonNode> actions) {
}
