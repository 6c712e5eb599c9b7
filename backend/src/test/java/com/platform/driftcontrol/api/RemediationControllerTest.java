package com.platform.driftcontrol.api;

import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.audit.RemediationStatistics;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.error.GlobalExceptionHandler;
import com.platform.driftcontrol.error.PlanConflictException;
import com.platform.driftcontrol.error.ValidationException;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationEngine;
import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationResult;
import com.platform.driftcontrol.remediation.RemediationStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemediationController Tests")
class RemediationControllerTest {
    
    private static final String CREATE_BODY = """
        {
          "scanId": "scan-42",
          "driftResults": [{
            "resourceId": "i-1",
            "resourceName": "aws_instance.web",
            "hasDrift": true,
            "driftedProperties": [
              {"propertyPath": "tags.Owner", "expectedValue": "ops", "actualValue": "dev", "changeType": "modified"}
            ]
          }]
        }
        """;
    
    @Mock
    private RemediationEngine engine;
    
    @Mock
    private RemediationAuditLog auditLog;
    
    private PlanRepository planRepository;
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        planRepository = new PlanRepository();
        mockMvc = MockMvcBuilders
            .standaloneSetup(new RemediationController(engine, planRepository, auditLog))
            .setControllerAdvice(new GlobalExceptionHandler(new RemediationMetrics(new SimpleMeterRegistry())))
            .build();
    }
    
    @Test
    @DisplayName("POST /plans creates and stores a plan")
    void createPlan() throws Exception {
        RemediationPlan plan = RemediationPlan.builder().scanId("scan-42").totalActions(1).build();
        when(engine.createPlan(anyList(), eq("scan-42"))).thenReturn(plan);
        
        mockMvc.perform(post("/api/remediation/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(plan.getId()))
            .andExpect(jsonPath("$.status").value("PENDING"));
        
        mockMvc.perform(get("/api/remediation/plans/{id}", plan.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scanId").value("scan-42"));
    }
    
    @Test
    @DisplayName("POST /plans without a scan id is rejected")
    void createPlanValidation() throws Exception {
        mockMvc.perform(post("/api/remediation/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scanId\": \"\", \"driftResults\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("DC-100"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("scanId"));
        
        verify(engine, never()).createPlan(any(), any());
    }
    
    @Test
    @DisplayName("unknown plan ids return 404")
    void unknownPlan() throws Exception {
        mockMvc.perform(get("/api/remediation/plans/{id}", "nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("DC-301"))
            .andExpect(jsonPath("$.metadata.resourceId").value("nope"));
    }
    
    @Test
    @DisplayName("POST /execute returns the results and keeps them for later")
    void executePlan() throws Exception {
        RemediationPlan plan = planRepository.save(RemediationPlan.builder().scanId("scan-1").build());
        RemediationResult result = RemediationResult.builder()
            .planId(plan.getId())
            .action(RemediationAction.builder().resourceName("aws_instance.web").build())
            .success(true)
            .duration(15)
            .output("Plan: 0 to add, 1 to change")
            .build();
        when(engine.executePlan(plan)).thenReturn(List.of(result));
        
        mockMvc.perform(post("/api/remediation/plans/{id}/execute", plan.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results[0].success").value(true))
            .andExpect(jsonPath("$.results[0].output").value("Plan: 0 to add, 1 to change"));
        
        mockMvc.perform(get("/api/remediation/plans/{id}/results", plan.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].duration").value(15));
    }
    
    @Test
    @DisplayName("executing a finished plan is a conflict")
    void executeConflict() throws Exception {
        RemediationPlan plan = planRepository.save(RemediationPlan.builder().scanId("scan-1").build());
        when(engine.executePlan(plan)).thenThrow(new PlanConflictException(plan.getId(), RemediationStatus.COMPLETED));
        
        mockMvc.perform(post("/api/remediation/plans/{id}/execute", plan.getId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("DC-310"));
    }
    
    @Test
    @DisplayName("approving an unknown action returns 404, a known one 200")
    void approveAction() throws Exception {
        when(engine.approveAction("a-1", "alice")).thenReturn(true);
        when(engine.approveAction("a-2", "alice")).thenReturn(false);
        
        mockMvc.perform(post("/api/remediation/approvals/{id}/approve", "a-1").param("approver", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.approvedBy").value("alice"));
        mockMvc.perform(post("/api/remediation/approvals/{id}/approve", "a-2").param("approver", "alice"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/remediation/approvals/{id}/approve", "a-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("DC-102"));
    }
    
    @Test
    @DisplayName("PUT /config rejects an invalid configuration")
    void updateConfigValidation() throws Exception {
        when(engine.updateConfig(any(RemediationConfig.class)))
            .thenThrow(new ValidationException("maxConcurrent", 0, "must be at least 1"));
        
        mockMvc.perform(put("/api/remediation/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"maxConcurrent\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("DC-110"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("maxConcurrent"));
    }
    
    @Test
    @DisplayName("GET /audit/statistics exposes the aggregates")
    void statistics() throws Exception {
        when(auditLog.getStatistics()).thenReturn(new RemediationStatistics(
            2, 5, 3, 2, 1, 120.5, List.of(new RemediationStatistics.FailureCount("Failed: timeout", 2))));
        
        mockMvc.perform(get("/api/remediation/audit/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalPlans").value(2))
            .andExpect(jsonPath("$.rolledBackActions").value(1))
            .andExpect(jsonPath("$.mostCommonFailures[0].error").value("Failed: timeout"));
    }
}
