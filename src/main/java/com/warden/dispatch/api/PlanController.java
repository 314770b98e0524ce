package com.warden.dispatch.api;

import com.warden.core.action.ActionFactory;
import com.warden.core.action.AgentAction;
import com.warden.core.engine.ActionExecutor;
import com.warden.core.engine.PlanEngine;
import com.warden.core.engine.PlanExporter;
import com.warden.core.engine.RunOptions;
import com.warden.core.model.DecomposedStep;
import com.warden.core.model.Plan;
import com.warden.core.model.PlanReflection;
import com.warden.core.scheduler.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller for plan lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanEngine planEngine;
    private final PlanExporter planExporter;
    private final SseStreamingService sseStreamingService;
    private final ActionExecutor executor;
    private final SchedulerProperties schedulerProperties;

    public PlanController(PlanEngine planEngine, PlanExporter planExporter, SseStreamingService sseStreamingService,
                          ActionExecutor executor, SchedulerProperties schedulerProperties) {
        this.planEngine = planEngine;
        this.planExporter = planExporter;
        this.sseStreamingService = sseStreamingService;
        this.executor = executor;
        this.schedulerProperties = schedulerProperties;
    }

    /**
     * POST /api/v1/plans: Build a plan and run it asynchronously.
     */
    @PostMapping
    public ResponseEntity<?> submitPlan(@RequestBody PlanRequest request) {
        if (request.goal() == null || request.goal().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Goal is required"));
        }

        Plan plan;
        RunOptions options;
        try {
            options = runOptions(request);
            plan = request.steps() == null || request.steps().isEmpty()
                    ? planEngine.buildPlan(request.goal())
                    : planEngine.buildPlan(request.goal(), toSteps(request.steps()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        String planId = plan.id();
        log.info("Accepted plan {} with {} tasks, launching async execution", planId, plan.tasks().size());
        planEngine.runPlanAsync(plan, executor, options)
                .whenComplete((summary, error) -> {
                    if (error != null) {
                        log.error("Plan {} failed", planId, error);
                    } else {
                        log.info("Plan {} finished as {}: {}/{} completed",
                                planId, plan.status(), summary.completed(), summary.total());
                    }
                });

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("plan_id", planId, "status", plan.status().name()));
    }

    /**
     * GET /api/v1/plans: List all plans.
     */
    @GetMapping
    public ResponseEntity<List<PlanResponse>> listPlans() {
        List<PlanResponse> list = planEngine.listPlans().stream()
                .map(p -> PlanResponse.from(p, planEngine.summarize(p)))
                .toList();
        return ResponseEntity.ok(list);
    }

    /**
     * GET /api/v1/plans/{id}: Plan with its tasks and summary.
     */
    @GetMapping("/{id}")
    public ResponseEntity<PlanResponse> getPlan(@PathVariable String id) {
        return planEngine.findPlan(id)
                .map(p -> ResponseEntity.ok(PlanResponse.from(p, planEngine.summarize(p))))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/plans/{id}/cancel: Cancel a plan and deny its pending confirmations.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancelPlan(@PathVariable String id,
                                                          @RequestParam(defaultValue = "user") String resolver) {
        var plan = planEngine.findPlan(id);
        if (plan.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean cancelled = planEngine.cancelPlan(plan.get(), resolver);
        if (!cancelled) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "plan_id", id,
                    "status", plan.get().status().name(),
                    "error", "Plan already finished"));
        }
        return ResponseEntity.ok(Map.of(
                "plan_id", id,
                "status", plan.get().status().name()));
    }

    /**
     * GET /api/v1/plans/{id}/export: Full plan document including the execution log.
     */
    @GetMapping("/{id}/export")
    public ResponseEntity<Map<String, Object>> exportPlan(@PathVariable String id) {
        return planEngine.findPlan(id)
                .map(p -> ResponseEntity.ok(planExporter.snapshot(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/plans/{id}/reflection: Success rate and recommendations.
     */
    @GetMapping("/{id}/reflection")
    public ResponseEntity<PlanReflection> reflect(@PathVariable String id) {
        return planEngine.findPlan(id)
                .map(p -> ResponseEntity.ok(planEngine.reflect(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/plans/{id}/events: SSE stream of plan events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (planEngine.findPlan(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private RunOptions runOptions(PlanRequest request) {
        RunOptions options = RunOptions.from(schedulerProperties);
        if (request.maxParallel() != null) {
            options = options.withParallelism(request.maxParallel());
        }
        if (request.confirmationTimeoutSeconds() != null) {
            options = options.withConfirmationTimeout(Duration.ofSeconds(request.confirmationTimeoutSeconds()));
        }
        return options;
    }

    private static List<DecomposedStep> toSteps(List<PlanRequest.StepRequest> steps) {
        var result = new ArrayList<DecomposedStep>(steps.size());
        for (PlanRequest.StepRequest step : steps) {
            AgentAction action = step.action() != null
                    ? ActionFactory.fromSpec(step.action().kind(), step.action().params())
                    : null;
            result.add(new DecomposedStep(step.id(), step.description(), step.dependsOn(), action));
        }
        return result;
    }
}
