package com.sunny.cron.core.job;

import com.sunny.cron.core.action.CallableAction;
import com.sunny.cron.core.action.ShellAction;
import com.sunny.cron.core.exception.ErrorType;
import com.sunny.cron.core.exception.JobLoadException;
import com.sunny.cron.core.handler.ActionHandlerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobDefinitionParserTest {

    private ActionHandlerRegistry handlerRegistry;
    private JobDefinitionParser parser;

    @BeforeEach
    void setUp() {
        handlerRegistry = new ActionHandlerRegistry();
        handlerRegistry.register("purgeSessions", () -> "ok");
        parser = new JobDefinitionParser(handlerRegistry);
    }

    private JobDefinition parse(String content) {
        return parser.parse("job.yml", new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    private JobLoadException parseFailure(String content) {
        return assertThrows(JobLoadException.class, () -> parse(content));
    }

    @Test
    void parse_shouldReadAllActionForms() {
        JobDefinition job = parse("""
                schedule: "*/5 * * * *"
                duration: 5000
                env: production
                actions:
                  - "echo hello world"
                  - command: /usr/bin/rsync
                    args: ["-a", "/src", "/dst"]
                  - handler: purgeSessions
                """);

        assertEquals("job.yml", job.id());
        assertEquals("*/5 * * * *", job.schedule());
        assertEquals(5000L, job.duration());
        assertEquals("production", job.env());
        assertFalse(job.disabled());
        assertEquals(3, job.actions().size());
        assertEquals(new ShellAction("echo", List.of("hello", "world")), job.actions().get(0));
        assertEquals(new ShellAction("/usr/bin/rsync", List.of("-a", "/src", "/dst")), job.actions().get(1));
        CallableAction handler = assertInstanceOf(CallableAction.class, job.actions().get(2));
        assertEquals("purgeSessions", handler.name());
        assertSame(handlerRegistry.getHandler("purgeSessions"), handler.callable());
    }

    @Test
    void parse_shouldApplyDefaults() {
        JobDefinition job = parse("""
                schedule: "0 3 * * *"
                actions: []
                """);

        assertNull(job.duration());
        assertEquals(60_000L, job.effectiveDuration(60_000L));
        assertFalse(job.disabled());
        assertNull(job.env());
        assertTrue(job.actions().isEmpty());
    }

    @Test
    void parse_shouldAcceptJson() {
        JobDefinition job = parse("{\"schedule\": \"* * * * *\", \"disabled\": true, \"actions\": [\"true\"]}");

        assertTrue(job.disabled());
        assertEquals(1, job.actions().size());
    }

    @Test
    void parse_shouldRejectMissingSchedule() {
        JobLoadException exception = parseFailure("""
                actions:
                  - "echo hi"
                """);

        assertEquals("job.yml", exception.getFile());
        assertEquals(ErrorType.JOB_LOAD_FAILED, exception.getType());
        assertTrue(exception.getMessage().contains("schedule"));
    }

    @Test
    void parse_shouldRejectSixFieldSchedule() {
        parseFailure("""
                schedule: "0 */5 * * * *"
                actions: []
                """);
    }

    @Test
    void parse_shouldRejectInvalidCronValue() {
        parseFailure("""
                schedule: "99 * * * *"
                actions: []
                """);
    }

    @Test
    void parse_shouldRejectNonPositiveDuration() {
        parseFailure("""
                schedule: "* * * * *"
                duration: 0
                actions: []
                """);
    }

    @Test
    void parse_shouldRejectFractionalDuration() {
        JobLoadException exception = parseFailure("""
                schedule: "* * * * *"
                duration: 1500.9
                actions: []
                """);

        assertTrue(exception.getMessage().startsWith("[job.yml] 解析失败"));
        parseFailure("""
                schedule: "* * * * *"
                duration: 0.5
                actions: []
                """);
    }

    @Test
    void parse_shouldRejectMissingActions() {
        JobLoadException exception = parseFailure("""
                schedule: "* * * * *"
                """);

        assertTrue(exception.getMessage().contains("actions"));
    }

    @Test
    void parse_shouldRejectUnknownProperty() {
        JobLoadException exception = parseFailure("""
                schedule: "* * * * *"
                timeout: 10
                actions: []
                """);

        assertTrue(exception.getMessage().contains("timeout"));
    }

    @Test
    void parse_shouldRejectActionWithBothCommandAndHandler() {
        parseFailure("""
                schedule: "* * * * *"
                actions:
                  - command: echo
                    handler: purgeSessions
                """);
    }

    @Test
    void parse_shouldRejectNonScalarAction() {
        parseFailure("""
                schedule: "* * * * *"
                actions:
                  - [echo, hi]
                """);
    }

    @Test
    void parse_shouldRejectBlankCommand() {
        parseFailure("""
                schedule: "* * * * *"
                actions:
                  - "   "
                """);
    }

    @Test
    void parse_shouldRejectUnregisteredHandler() {
        JobLoadException exception = parseFailure("""
                schedule: "* * * * *"
                actions:
                  - handler: rebuildIndex
                """);

        assertTrue(exception.getMessage().contains("rebuildIndex"));
    }

    @Test
    void parse_shouldRejectHandlerWithoutRegistry() {
        JobDefinitionParser bare = new JobDefinitionParser();

        assertThrows(JobLoadException.class, () -> bare.parse("job.yml", new ByteArrayInputStream("""
                schedule: "* * * * *"
                actions:
                  - handler: purgeSessions
                """.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void parse_shouldRejectMalformedDocument() {
        JobLoadException exception = parseFailure("schedule: [unclosed");

        assertTrue(exception.getMessage().startsWith("[job.yml] 解析失败"));
    }

    @Test
    void parse_shouldReportUnreadableFile() {
        Path missing = Path.of("cronguard-missing-dir", "gone.yml");

        JobLoadException exception = assertThrows(JobLoadException.class, () -> parser.parse(missing));

        assertEquals("gone.yml", exception.getFile());
        assertTrue(exception.getMessage().contains("读取失败"));
    }
}
