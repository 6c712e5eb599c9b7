package com.platform.driftcontrol.config;

import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for drift remediation.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "drift.remediation")
public class RemediationProperties {
    
    private boolean dryRun = true;
    
    private boolean autoApprove = false;
    
    private Set<RemediationSeverity> requireApprovalFor = EnumSet.of(
        RemediationSeverity.LOW_RISK,
        RemediationSeverity.MEDIUM_RISK,
        RemediationSeverity.HIGH_RISK,
        RemediationSeverity.CRITICAL
    );
    
    private Duration approvalTimeout;
    
    private int maxConcurrent = 1;
    
    private boolean continueOnError = false;
    
    private boolean rollbackOnError = true;
    
    private boolean destructiveActionsAllowed = false;
    
    private boolean backupBeforeChange = true;
    
    private List<String> includeResources;
    
    private List<String> excludeResources;
    
    private Integer maxActionsPerRun;
    
    private List<String> sourceRewritePatterns = List.of();
    
    /**
     * Infrastructure tool settings.
     */
    private Terraform terraform = new Terraform();
    
    /**
     * Audit log settings.
     */
    private Audit audit = new Audit();
    
    /**
     * Span export for plan and action executions.
     */
    private Tracing tracing = new Tracing();
    
    /**
     * Build the immutable policy snapshot used by the engine.
     */
    public RemediationConfig toRemediationConfig() {
        return RemediationConfig.builder()
            .dryRun(dryRun)
            .autoApprove(autoApprove)
            .requireApprovalFor(requireApprovalFor == null ? Set.of() : Set.copyOf(requireApprovalFor))
            .approvalTimeout(approvalTimeout)
            .maxConcurrent(maxConcurrent)
            .continueOnError(continueOnError)
            .rollbackOnError(rollbackOnError)
            .destructiveActionsAllowed(destructiveActionsAllowed)
            .backupBeforeChange(backupBeforeChange)
            .includeResources(includeResources == null ? null : List.copyOf(includeResources))
            .excludeResources(excludeResources == null ? null : List.copyOf(excludeResources))
            .maxActionsPerRun(maxActionsPerRun)
            .sourceRewritePatterns(sourceRewritePatterns == null ? List.of() : List.copyOf(sourceRewritePatterns))
            .build();
    }
    
    @Data
    public static class Terraform {
        /**
         * Binary name or path, resolved via PATH when not absolute.
         */
        private String binary = "terraform";
        
        private String workingDirectory = ".";
        
        /**
         * Optional -var-file passed to plan and apply.
         */
        private String varFile;
        
        /**
         * Defaults to {@code <working-directory>/.terraform-backup}.
         */
        private String backupDirectory;
        
        private String stateFile = "terraform.tfstate";
        
        private Duration commandTimeout = Duration.ofMinutes(30);
        
        /**
         * Extra environment for the child process only (cloud credentials, TF_* settings).
         */
        private Map<String, String> environment = new HashMap<>();
    }
    
    @Data
    public static class Tracing {
        private boolean enabled = false;
        
        /**
         * OTLP gRPC collector endpoint.
         */
        private String endpoint = "http://localhost:4317";
        
        /**
         * Fraction of plan executions traced, between 0 and 1.
         */
        private double samplingRatio = 1.0;
    }
    
    @Data
    public static class Audit {
        private String directory = "remediation-logs";
        
        /**
         * Recent entries kept in memory for the audit queries. Older ones remain in the partitions.
         */
        private int maxInMemoryEntries = RemediationAuditLog.DEFAULT_MAX_IN_MEMORY_ENTRIES;
    }
}
