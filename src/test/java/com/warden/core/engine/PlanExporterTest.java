package com.warden.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.action.FileAction;
import com.warden.core.action.FileOperation;
import com.warden.core.audit.AuditLog;
import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.events.EventBus;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.DecomposedStep;
import com.warden.core.model.Plan;
import com.warden.core.risk.PolicyConfig;
import com.warden.core.risk.RiskClassifier;
import com.warden.core.scheduler.SchedulerProperties;
import com.warden.core.scheduler.TaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanExporterTest {

    private ConfirmationGateway gateway;
    private PlanEngine engine;
    private PlanExporter exporter;

    @BeforeEach
    void setUp() {
        var auditLog = new AuditLog();
        var metrics = new WardenMetrics(new SimpleMeterRegistry());
        gateway = new ConfirmationGateway(new RiskClassifier(PolicyConfig.defaults()), auditLog, List.of(),
                metrics, Duration.ofSeconds(5), 10);
        var properties = new SchedulerProperties();
        properties.setPollInterval(Duration.ofMillis(10));
        engine = new PlanEngine(new TaskScheduler(), gateway, auditLog, new EventBus(), metrics, properties,
                (action, description) -> "ok");
        exporter = new PlanExporter(engine);
    }

    @AfterEach
    void tearDown() {
        gateway.shutdown();
        engine.shutdown();
    }

    @Test
    @DisplayName("export contains tasks, summary and the execution log")
    void exportDocument(@TempDir Path dir) throws Exception {
        Plan plan = engine.buildPlan("Archive logs", List.of(
                new DecomposedStep("read", "Read the log", null, new FileAction(FileOperation.READ, "/var/log/app.log")),
                new DecomposedStep("pack", "Pack it", List.of("read"), null)));
        engine.runPlan(plan);

        Path file = dir.resolve("plan.json");
        exporter.exportTo(plan, file);
        JsonNode json = new ObjectMapper().readTree(Files.readString(file));

        assertEquals(plan.id(), json.get("planId").asText());
        assertEquals("COMPLETED", json.get("status").asText());
        assertEquals(2, json.get("tasks").size());
        JsonNode first = json.get("tasks").get(0);
        assertEquals("FILE_OPERATION", first.get("actionKind").asText());
        assertEquals("read_file", first.get("actionName").asText());
        assertFalse(first.has("action"));
        assertEquals("read", json.get("tasks").get(1).get("dependencies").get(0).asText());
        assertEquals(2, json.get("summary").get("completed").asInt());
        assertTrue(json.get("executionLog").size() >= 6);
        assertTrue(json.get("createdAt").isTextual());
    }

    @Test
    @DisplayName("a plan that has not run exports with empty timestamps")
    void pendingPlan() {
        Plan plan = engine.buildPlan("Later", List.of(DecomposedStep.of("one")));

        String json = exporter.toJson(plan);

        assertTrue(json.contains("\"status\" : \"PENDING\""));
        assertTrue(json.contains("\"startedAt\" : null"));
    }
}
