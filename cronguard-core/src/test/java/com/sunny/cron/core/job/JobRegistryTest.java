package com.sunny.cron.core.job;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRegistryTest {

    private static JobDefinition job(String id, boolean disabled, String env) {
        return new JobDefinition(id, "* * * * *", null, List.of(), disabled, env);
    }

    private static Map<String, JobDefinition> jobs(JobDefinition... definitions) {
        Map<String, JobDefinition> map = new LinkedHashMap<>();
        for (JobDefinition definition : definitions) {
            map.put(definition.id(), definition);
        }
        return map;
    }

    private static Set<String> enabledIds(JobRegistry registry) {
        return registry.enabledJobs().map(JobDefinition::id).collect(Collectors.toSet());
    }

    @Test
    void enabledJobs_shouldExcludeDisabled() {
        JobRegistry registry = new JobRegistry(jobs(job("a.yml", false, null), job("b.yml", true, null)), null);

        assertEquals(Set.of("a.yml"), enabledIds(registry));
        assertEquals(2, registry.size());
        assertTrue(registry.get("b.yml").isPresent());
    }

    @Test
    void enabledJobs_shouldReturnFreshStreamEachCall() {
        JobRegistry registry = new JobRegistry(jobs(job("a.yml", false, null)), null);

        assertEquals(1, registry.enabledJobs().count());
        assertEquals(1, registry.enabledJobs().count());
    }

    @Test
    void enabledJobs_shouldFilterByActiveEnv() {
        JobRegistry registry = new JobRegistry(jobs(
                job("all.yml", false, null),
                job("prod.yml", false, "production"),
                job("staging.yml", false, "staging")), "production");

        assertEquals(Set.of("all.yml", "prod.yml"), enabledIds(registry));
    }

    @Test
    void enabledJobs_shouldIgnoreEnvWhenNoActiveEnv() {
        JobRegistry registry = new JobRegistry(jobs(
                job("prod.yml", false, "production"),
                job("staging.yml", false, "staging")), " ");

        assertEquals(Set.of("prod.yml", "staging.yml"), enabledIds(registry));
    }
}
