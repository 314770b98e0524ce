package com.warden.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.core.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialises a plan to JSON: {@code {planId, goal, status, createdAt, startedAt, completedAt,
 * tasks[], summary, executionLog[]}}.
 */
@Component
public class PlanExporter {

    private static final Logger log = LoggerFactory.getLogger(PlanExporter.class);

    private final PlanEngine planEngine;
    private final ObjectMapper objectMapper;

    public PlanExporter(PlanEngine planEngine) {
        this.planEngine = planEngine;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, Object> snapshot(Plan plan) {
        var document = new LinkedHashMap<String, Object>();
        document.put("planId", plan.id());
        document.put("goal", plan.goal());
        document.put("status", plan.status());
        document.put("createdAt", plan.createdAt());
        document.put("startedAt", plan.startedAt());
        document.put("completedAt", plan.completedAt());
        document.put("tasks", plan.tasks());
        document.put("summary", planEngine.summarize(plan));
        document.put("executionLog", plan.executionLog());
        return document;
    }

    public String toJson(Plan plan) {
        try {
            return objectMapper.writeValueAsString(snapshot(plan));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialise plan " + plan.id(), e);
        }
    }

    public void exportTo(Plan plan, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(plan));
        log.info("Plan {} exported to {}", plan.id(), file);
    }
}
