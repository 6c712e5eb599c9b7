package com.platform.driftcontrol.remediation.approval;

import com.platform.driftcontrol.audit.AuditEntry;
import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PendingApprovalGate Tests")
class PendingApprovalGateTest {
    
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    
    @TempDir
    Path auditDir;
    
    private RemediationAuditLog auditLog;
    private PendingApprovalGate gate;
    
    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        auditLog = new RemediationAuditLog(auditDir, clock);
        gate = new PendingApprovalGate(auditLog, clock);
    }
    
    @Test
    @DisplayName("denies a covered severity and registers a pending request")
    void deniesAndRegisters() {
        // Given
        RemediationAction action = action(RemediationSeverity.HIGH_RISK);
        RemediationConfig config = RemediationConfig.builder().approvalTimeout(Duration.ofHours(1)).build();
        
        // When
        boolean approved = gate.requestApproval("plan-1", action, config);
        
        // Then
        assertThat(approved).isFalse();
        assertThat(gate.getPendingApprovals()).singleElement().satisfies(request -> {
            assertThat(request.getActionId()).isEqualTo(action.getId());
            assertThat(request.getPlanId()).isEqualTo("plan-1");
            assertThat(request.getSeverity()).isEqualTo(RemediationSeverity.HIGH_RISK);
            assertThat(request.getRequestedAt()).isEqualTo(NOW);
            assertThat(request.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
            assertThat(request.isExpired(NOW)).isFalse();
        });
        assertThat(auditLog.getLogsByAction(action.getId()))
            .extracting(AuditEntry::message)
            .containsExactly("Approval required for HIGH_RISK action: Apply infrastructure change: res.path");
    }
    
    @Test
    @DisplayName("approves severities outside the configured policy without a request")
    void approvesUncoveredSeverity() {
        RemediationConfig config = RemediationConfig.builder()
            .requireApprovalFor(Set.of(RemediationSeverity.CRITICAL))
            .build();
        
        assertThat(gate.requestApproval("plan-1", action(RemediationSeverity.HIGH_RISK), config)).isTrue();
        assertThat(gate.getPendingApprovals()).isEmpty();
    }
    
    @Test
    @DisplayName("an out-of-band approval is honoured on the next request")
    void honoursRecordedApproval() {
        RemediationAction action = action(RemediationSeverity.MEDIUM_RISK);
        RemediationConfig config = RemediationConfig.defaults();
        
        assertThat(gate.requestApproval("plan-1", action, config)).isFalse();
        assertThat(gate.approveAction(action.getId(), "alice")).isTrue();
        
        assertThat(gate.getPendingApprovals()).isEmpty();
        assertThat(gate.requestApproval("plan-1", action, config)).isTrue();
        assertThat(auditLog.getLogsByAction(action.getId()))
            .extracting(AuditEntry::message)
            .contains("Action approved by alice", "Using approval granted by alice");
        assertThat(gate.requestApproval("plan-1", action, config)).isFalse();
    }
    
    @Test
    @DisplayName("evicts the oldest requests beyond capacity")
    void evictsOldestRequests() {
        // Given
        PendingApprovalGate bounded = new PendingApprovalGate(auditLog, Clock.fixed(NOW, ZoneOffset.UTC), 2);
        RemediationAction first = action(RemediationSeverity.HIGH_RISK);
        RemediationAction second = action(RemediationSeverity.HIGH_RISK);
        RemediationAction third = action(RemediationSeverity.HIGH_RISK);
        
        // When
        for (RemediationAction action : List.of(first, second, third)) {
            bounded.requestApproval("plan-1", action, RemediationConfig.defaults());
        }
        
        // Then
        assertThat(bounded.getPendingApprovals())
            .extracting(ApprovalRequest::getActionId)
            .containsExactlyInAnyOrder(second.getId(), third.getId());
        assertThat(bounded.approveAction(first.getId(), "alice")).isFalse();
    }
    
    @Test
    @DisplayName("approving an unknown action reports false")
    void unknownAction() {
        assertThat(gate.approveAction("missing", "alice")).isFalse();
    }
    
    private static RemediationAction action(RemediationSeverity severity) {
        return RemediationAction.builder()
            .resourceName("res")
            .propertyPath("path")
            .severity(severity)
            .description("Apply infrastructure change: res.path")
            .requiresApproval(true)
            .build();
    }
}
