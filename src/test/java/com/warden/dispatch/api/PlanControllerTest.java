package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.action.StepAction;
import com.warden.core.engine.ActionExecutor;
import com.warden.core.engine.PlanEngine;
import com.warden.core.engine.PlanExporter;
import com.warden.core.model.Plan;
import com.warden.core.model.PlanReflection;
import com.warden.core.model.PlanStatus;
import com.warden.core.model.PlanSummary;
import com.warden.core.model.Task;
import com.warden.core.scheduler.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PlanController.class)
@Import(SchedulerProperties.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PlanEngine planEngine;

    @MockitoBean
    private PlanExporter planExporter;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @MockitoBean
    private ActionExecutor actionExecutor;

    private Plan plan;

    @BeforeEach
    void setUp() {
        plan = new Plan("PLAN-2026-0001", "Tidy desktop", List.of(
                Task.create("TASK-001", "List files", new StepAction("List files"), List.of(), 3),
                Task.create("TASK-002", "Sort files", new StepAction("Sort files"), List.of("TASK-001"), 3)));
        when(planEngine.runPlanAsync(any(), any(), any())).thenReturn(new CompletableFuture<>());
        when(planEngine.summarize(any())).thenAnswer(inv ->
                PlanSummary.of(((Plan) inv.getArgument(0)).tasks(), List.of(), null));
    }

    // ── POST /api/v1/plans ───────────────────────────────────────────

    @Test
    @DisplayName("POST /plans with steps returns 202 Accepted with plan_id")
    void submitWithSteps() throws Exception {
        when(planEngine.buildPlan(eq("Tidy desktop"), anyList())).thenReturn(plan);

        String body = objectMapper.writeValueAsString(new PlanRequest("Tidy desktop", List.of(
                new PlanRequest.StepRequest("TASK-001", "List files", null, null),
                new PlanRequest.StepRequest("TASK-002", "Sort files", List.of("TASK-001"),
                        new PlanRequest.ActionRequest("FILE_OPERATION", Map.of("operation", "move", "path", "~/a.txt")))),
                2, 30));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.plan_id").value("PLAN-2026-0001"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        verify(planEngine).runPlanAsync(eq(plan), eq(actionExecutor), any());
    }

    @Test
    @DisplayName("POST /plans without steps decomposes the goal")
    void submitWithoutSteps() throws Exception {
        when(planEngine.buildPlan("Tidy desktop")).thenReturn(plan);

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\": \"Tidy desktop\"}"))
                .andExpect(status().isAccepted());

        verify(planEngine).buildPlan("Tidy desktop");
    }

    @Test
    @DisplayName("POST /plans with a blank goal returns 400")
    void blankGoal() throws Exception {
        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Goal is required"));
    }

    @Test
    @DisplayName("POST /plans with an unknown action kind returns 400 and runs nothing")
    void invalidAction() throws Exception {
        String body = """
                {"goal": "Teleport", "steps": [
                  {"description": "Beam up", "action": {"kind": "TELEPORT", "params": {}}}
                ]}
                """;

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("TELEPORT")));

        verify(planEngine, never()).runPlanAsync(any(), any(), any());
    }

    @Test
    @DisplayName("POST /plans with zero parallelism returns 400")
    void invalidParallelism() throws Exception {
        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goal\": \"Tidy\", \"max_parallel\": 0}"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/plans ────────────────────────────────────────────

    @Test
    @DisplayName("GET /plans/{id} returns the plan with its tasks and summary")
    void getPlan() throws Exception {
        when(planEngine.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(plan));

        mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan_id").value("PLAN-2026-0001"))
                .andExpect(jsonPath("$.tasks", hasSize(2)))
                .andExpect(jsonPath("$.tasks[1].dependencies[0]").value("TASK-001"))
                .andExpect(jsonPath("$.tasks[0].action_kind").value("GENERIC"))
                .andExpect(jsonPath("$.summary.total").value(2));
    }

    @Test
    @DisplayName("GET /plans/{id} for an unknown plan returns 404")
    void getUnknownPlan() throws Exception {
        when(planEngine.findPlan("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/plans/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /plans lists every plan")
    void listPlans() throws Exception {
        when(planEngine.listPlans()).thenReturn(List.of(plan));

        mockMvc.perform(get("/api/v1/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].goal").value("Tidy desktop"));
    }

    @Test
    @DisplayName("GET /plans/{id}/reflection returns recommendations")
    void reflection() throws Exception {
        when(planEngine.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(plan));
        when(planEngine.reflect(plan)).thenReturn(new PlanReflection("PLAN-2026-0001", PlanStatus.COMPLETED,
                2, 1, 1, 0.5, List.of("TASK-002"), List.of("Fix 1 failed tasks")));

        mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001/reflection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendations[0]").value("Fix 1 failed tasks"));
    }

    // ── POST /api/v1/plans/{id}/cancel ───────────────────────────────

    @Test
    @DisplayName("POST /plans/{id}/cancel cancels a running plan")
    void cancel() throws Exception {
        when(planEngine.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(plan));
        when(planEngine.cancelPlan(plan, "operator")).thenReturn(true);

        mockMvc.perform(post("/api/v1/plans/PLAN-2026-0001/cancel").param("resolver", "operator"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan_id").value("PLAN-2026-0001"));
    }

    @Test
    @DisplayName("POST /plans/{id}/cancel on a finished plan returns 409")
    void cancelFinished() throws Exception {
        when(planEngine.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(plan));
        when(planEngine.cancelPlan(plan, "user")).thenReturn(false);

        mockMvc.perform(post("/api/v1/plans/PLAN-2026-0001/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Plan already finished"));
    }

    @Test
    @DisplayName("POST /plans/{id}/cancel on an unknown plan returns 404")
    void cancelUnknown() throws Exception {
        when(planEngine.findPlan("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/plans/nope/cancel"))
                .andExpect(status().isNotFound());
    }
}
