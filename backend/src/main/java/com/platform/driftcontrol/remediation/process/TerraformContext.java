package com.platform.driftcontrol.remediation.process;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Where and how terraform is invoked. Environment entries are passed to the child
 * process only and never to the JVM's own environment.
 */
@Value
@Builder
public class TerraformContext {
    
    @Builder.Default
    String binary = "terraform";
    
    @Builder.Default
    Path workingDirectory = Path.of(".");
    
    String varFile;
    
    Path backupDirectory;
    
    @Builder.Default
    String stateFile = "terraform.tfstate";
    
    @Builder.Default
    Duration commandTimeout = Duration.ofMinutes(30);
    
    @Singular("environmentVariable")
    Map<String, String> environment;
    
    public Path resolvedBackupDirectory() {
        return backupDirectory != null ? backupDirectory : workingDirectory.resolve(".terraform-backup");
    }
    
    public Path resolvedStateFile() {
        return workingDirectory.resolve(stateFile);
    }
}
