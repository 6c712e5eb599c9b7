package com.platform.driftcontrol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationEngine;
import com.platform.driftcontrol.remediation.approval.ApprovalGate;
import com.platform.driftcontrol.remediation.approval.PendingApprovalGate;
import com.platform.driftcontrol.remediation.execution.ActionStateMachine;
import com.platform.driftcontrol.remediation.execution.RemediationExecutor;
import com.platform.driftcontrol.remediation.plan.RemediationPlanBuilder;
import com.platform.driftcontrol.remediation.process.ProcessRunner;
import com.platform.driftcontrol.remediation.process.TerraformContext;
import com.platform.driftcontrol.remediation.process.TerraformProcessRunner;
import com.platform.driftcontrol.remediation.process.source.SourceRewriter;
import com.platform.driftcontrol.remediation.process.source.TextualHclRewriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the remediation components from {@link RemediationProperties}.
 */
@Slf4j
@Configuration
public class RemediationConfiguration {
    
    @Bean
    public Clock remediationClock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public RemediationMetrics remediationMetrics(MeterRegistry meterRegistry) {
        return new RemediationMetrics(meterRegistry);
    }
    
    @Bean
    public RemediationAuditLog remediationAuditLog(RemediationProperties properties, ObjectMapper objectMapper, Clock clock) {
        Path directory = Path.of(properties.getAudit().getDirectory());
        log.info("Remediation audit log directory: {}", directory.toAbsolutePath());
        return new RemediationAuditLog(directory, objectMapper, clock, properties.getAudit().getMaxInMemoryEntries());
    }
    
    @Bean
    public TerraformContext terraformContext(RemediationProperties properties) {
        RemediationProperties.Terraform terraform = properties.getTerraform();
        Path workingDirectory = Path.of(terraform.getWorkingDirectory());
        return TerraformContext.builder()
            .binary(terraform.getBinary())
            .workingDirectory(workingDirectory)
            .varFile(terraform.getVarFile())
            .backupDirectory(terraform.getBackupDirectory() == null ? null : Path.of(terraform.getBackupDirectory()))
            .stateFile(terraform.getStateFile())
            .commandTimeout(terraform.getCommandTimeout())
            .environment(terraform.getEnvironment())
            .build();
    }
    
    @Bean
    public SourceRewriter sourceRewriter() {
        return new TextualHclRewriter();
    }
    
    @Bean
    public ProcessRunner processRunner(TerraformContext context, SourceRewriter sourceRewriter,
                                       RemediationMetrics metrics, Clock clock) {
        return new TerraformProcessRunner(context, sourceRewriter, metrics, clock);
    }
    
    @Bean
    public ApprovalGate approvalGate(RemediationAuditLog auditLog, Clock clock) {
        return new PendingApprovalGate(auditLog, clock);
    }
    
    @Bean
    public ActionStateMachine actionStateMachine(Clock clock) {
        return new ActionStateMachine(clock);
    }
    
    @Bean
    public RemediationPlanBuilder remediationPlanBuilder(RemediationAuditLog auditLog, RemediationMetrics metrics, Clock clock) {
        return new RemediationPlanBuilder(auditLog, metrics, clock);
    }
    
    @Bean
    public RemediationExecutor remediationExecutor(ProcessRunner processRunner, ApprovalGate approvalGate,
                                                   ActionStateMachine stateMachine, RemediationAuditLog auditLog,
                                                   RemediationMetrics metrics, Tracer tracer, Clock clock) {
        return new RemediationExecutor(processRunner, approvalGate, stateMachine, auditLog, metrics, tracer, clock);
    }
    
    @Bean
    public RemediationEngine remediationEngine(RemediationPlanBuilder planBuilder, RemediationExecutor executor,
                                               ApprovalGate approvalGate, RemediationProperties properties) {
        return new RemediationEngine(planBuilder, executor, approvalGate, properties.toRemediationConfig());
    }
}
