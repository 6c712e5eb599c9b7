package com.platform.driftcontrol.remediation;

import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.drift.DriftResult;
import com.platform.driftcontrol.error.ValidationException;
import com.platform.driftcontrol.remediation.approval.ApprovalGate;
import com.platform.driftcontrol.remediation.execution.RemediationExecutor;
import com.platform.driftcontrol.remediation.plan.RemediationPlanBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemediationEngine Tests")
class RemediationEngineTest {

    @Mock
    private RemediationPlanBuilder planBuilder;

    @Mock
    private RemediationExecutor executor;

    @Mock
    private ApprovalGate approvalGate;

    private RemediationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RemediationEngine(planBuilder, executor, approvalGate, RemediationConfig.defaults());
    }

    @Test
    @DisplayName("rejects an invalid initial configuration")
    void rejectsInvalidInitialConfig() {
        RemediationConfig invalid = RemediationConfig.builder().maxConcurrent(0).build();

        assertThatThrownBy(() -> new RemediationEngine(planBuilder, executor, approvalGate, invalid))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxConcurrent");
    }

    @Test
    @DisplayName("creates plans with the active configuration")
    void createsPlanWithActiveConfig() {
        // Given
        List<DriftResult> drift = List.of();
        RemediationPlan plan = RemediationPlan.builder().scanId("scan-1").build();
        when(planBuilder.createPlan(same(drift), eq("scan-1"), any())).thenReturn(plan);

        // When
        RemediationPlan created = engine.createPlan(drift, "scan-1");

        // Then
        assertThat(created).isSameAs(plan);
        verify(planBuilder).createPlan(drift, "scan-1", engine.getConfig());
    }

    @Test
    @DisplayName("executes with the configuration active at call time")
    void executesWithUpdatedConfig() {
        // Given
        RemediationConfig live = RemediationConfig.builder().dryRun(false).maxConcurrent(3).build();
        engine.updateConfig(live);
        RemediationPlan plan = RemediationPlan.builder().build();
        when(executor.executePlan(same(plan), any())).thenReturn(List.of());

        // When
        engine.executePlan(plan);

        // Then
        ArgumentCaptor<RemediationConfig> captor = ArgumentCaptor.forClass(RemediationConfig.class);
        verify(executor).executePlan(same(plan), captor.capture());
        assertThat(captor.getValue()).isSameAs(live);
        assertThat(captor.getValue().isDryRun()).isFalse();
    }

    @Test
    @DisplayName("keeps the previous configuration when an update is invalid")
    void invalidUpdateKeepsPrevious() {
        // Given
        RemediationConfig before = engine.getConfig();
        RemediationConfig invalid = before.toBuilder().maxActionsPerRun(0).build();

        // When / Then
        assertThatThrownBy(() -> engine.updateConfig(invalid))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxActionsPerRun");
        assertThat(engine.getConfig()).isSameAs(before);
    }

    @Test
    @DisplayName("delegates approvals to the gate")
    void delegatesApprovals() {
        when(approvalGate.approveAction("action-1", "alice")).thenReturn(true);
        when(approvalGate.getPendingApprovals()).thenReturn(List.of());

        assertThat(engine.approveAction("action-1", "alice")).isTrue();
        assertThat(engine.getPendingApprovals()).isEmpty();
    }
}
