package com.warden.dispatch.api;

import com.warden.core.action.ActionKind;
import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.confirmation.ConfirmationSnapshot;
import com.warden.core.confirmation.ConfirmationStatus;
import com.warden.core.confirmation.ResponseResult;
import com.warden.core.risk.RiskTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfirmationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ConfirmationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConfirmationGateway gateway;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static ConfirmationSnapshot pending(String id, String planId) {
        return new ConfirmationSnapshot(id, ActionKind.FILE_OPERATION, "delete_file", RiskTier.WARNING,
                "Delete old report", Map.of("operation", "delete", "file_path", "/tmp/report.txt"),
                "Operation: delete\nFile Path: /tmp/report.txt", ConfirmationStatus.PENDING,
                planId, "TASK-001", Instant.parse("2026-10-18T12:00:00Z"), 60, null, null, null);
    }

    @Test
    @DisplayName("GET /pending lists requests with snake_case fields")
    void listPending() throws Exception {
        when(gateway.listPending()).thenReturn(List.of(pending("CR-1", "PLAN-2026-0001")));

        mockMvc.perform(get("/api/v1/confirmations/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("CR-1"))
                .andExpect(jsonPath("$[0].risk_tier").value("WARNING"))
                .andExpect(jsonPath("$[0].action_type").value("FILE_OPERATION"))
                .andExpect(jsonPath("$[0].timeout_seconds").value(60))
                .andExpect(jsonPath("$[0].formatted_details", containsString("File Path: /tmp/report.txt")));
    }

    @Test
    @DisplayName("GET /pending?plan_id filters by plan")
    void listPendingForPlan() throws Exception {
        when(gateway.listPending("PLAN-2026-0002")).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/confirmations/pending").param("plan_id", "PLAN-2026-0002"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        verify(gateway).listPending("PLAN-2026-0002");
    }

    @Test
    @DisplayName("GET /{id} for an unknown request returns 404")
    void unknownRequest() throws Exception {
        when(gateway.find("CR-404")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/confirmations/CR-404"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /{id}/response approves a pending request")
    void approve() throws Exception {
        when(gateway.submitResponse("CR-1", true, "alice")).thenReturn(ResponseResult.RESOLVED);

        mockMvc.perform(post("/api/v1/confirmations/CR-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true, \"resolver\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("RESOLVED"))
                .andExpect(jsonPath("$.approved").value(true));
    }

    @Test
    @DisplayName("POST /{id}/response defaults the resolver to user")
    void defaultResolver() throws Exception {
        when(gateway.submitResponse("CR-1", false, "user")).thenReturn(ResponseResult.RESOLVED);

        mockMvc.perform(post("/api/v1/confirmations/CR-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": false}"))
                .andExpect(status().isOk());

        verify(gateway).submitResponse("CR-1", false, "user");
    }

    @Test
    @DisplayName("POST /{id}/response to an unknown request returns 404")
    void respondUnknown() throws Exception {
        when(gateway.submitResponse("CR-404", true, "user")).thenReturn(ResponseResult.NOT_FOUND);

        mockMvc.perform(post("/api/v1/confirmations/CR-404/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.result").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /{id}/response after resolution returns 409")
    void respondTwice() throws Exception {
        when(gateway.submitResponse("CR-1", true, "user")).thenReturn(ResponseResult.ALREADY_RESOLVED);

        mockMvc.perform(post("/api/v1/confirmations/CR-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved\": true}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /{id}/response without a decision returns 400")
    void missingDecision() throws Exception {
        mockMvc.perform(post("/api/v1/confirmations/CR-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolver\": \"alice\"}"))
                .andExpect(status().isBadRequest());

        verify(gateway, never()).submitResponse(anyString(), anyBoolean(), anyString());
    }

    @Test
    @DisplayName("GET /history passes the limit through")
    void history() throws Exception {
        when(gateway.getHistory(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/confirmations/history").param("limit", "5"))
                .andExpect(status().isOk());

        verify(gateway).getHistory(5);
    }
}
