package com.platform.driftcontrol.remediation.process;

import com.platform.driftcontrol.error.ErrorCode;
import com.platform.driftcontrol.error.ProcessExecutionException;
import com.platform.driftcontrol.error.RollbackUnavailableException;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import com.platform.driftcontrol.remediation.RemediationStrategy;
import com.platform.driftcontrol.remediation.process.source.TextualHclRewriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against a shell script standing in for the terraform binary.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("TerraformProcessRunner Tests")
class TerraformProcessRunnerTest {
    
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    
    private static final String FAKE_TERRAFORM = String.join("\n",
        "#!/bin/sh",
        "echo \"$@\" >> \"$CALLS_FILE\"",
        "case \"$1\" in",
        "  plan)",
        "    if [ -n \"$SLOW_PLAN\" ]; then sleep 5; fi",
        "    echo \"Plan: 0 to add, 1 to change, 0 to destroy.\" ;;",
        "  apply)",
        "    if [ -n \"$FAIL_APPLY\" ]; then echo \"Error: apply exploded\" >&2; exit 1; fi",
        "    echo \"Apply complete! Resources: 0 added, 1 changed, 0 destroyed.\" ;;",
        "  state)",
        "    if [ \"$2\" = \"pull\" ]; then echo '{\"version\":4,\"serial\":7}'; fi",
        "    if [ \"$2\" = \"push\" ]; then cat \"$4\" > pushed.tfstate; fi ;;",
        "  *)",
        "    echo \"unknown command $1\" >&2; exit 2 ;;",
        "esac",
        "");
    
    @TempDir
    Path workDir;
    
    private Path binary;
    private Path callsFile;
    private SimpleMeterRegistry meterRegistry;
    
    @BeforeEach
    void setUp() throws IOException {
        binary = workDir.resolve("bin/terraform");
        Files.createDirectories(binary.getParent());
        Files.writeString(binary, FAKE_TERRAFORM, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(binary, PosixFilePermissions.fromString("rwxr-xr-x"));
        callsFile = workDir.resolve("calls.log");
        meterRegistry = new SimpleMeterRegistry();
    }
    
    @Test
    @DisplayName("plan is scoped to the resource and returns stdout")
    void planIsTargeted() throws IOException {
        TerraformProcessRunner runner = runner(context().varFile("prod.tfvars").build());
        
        String output = runner.plan(action());
        
        assertThat(output).contains("1 to change");
        assertThat(calls()).containsExactly("plan -no-color -input=false -var-file=prod.tfvars -target=aws_instance.web");
        assertThat(meterRegistry.get("driftcontrol.process.invocations").tag("operation", "plan").counter().count())
            .isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("apply backs up the local state file first and records it for rollback")
    void applyBacksUpLocalState() throws IOException {
        Files.writeString(workDir.resolve("terraform.tfstate"), "{\"serial\":1}", StandardCharsets.UTF_8);
        TerraformProcessRunner runner = runner(context().build());
        RemediationAction action = action();
        
        String output = runner.apply(action);
        
        assertThat(output).startsWith("Plan:\n").contains("Apply:\n", "Apply complete!");
        assertThat(calls()).containsExactly(
            "plan -no-color -input=false -target=aws_instance.web",
            "apply -auto-approve -no-color -input=false -target=aws_instance.web");
        
        assertThat(action.getRollbackData()).isNotNull();
        StateBackup backup = action.getRollbackData().stateBackup();
        assertThat(backup.takenAt()).isEqualTo(NOW);
        assertThat(backup.file().getParent()).isEqualTo(workDir.resolve(".terraform-backup"));
        assertThat(backup.file().getFileName().toString()).startsWith("state-" + NOW.toEpochMilli() + "-");
        assertThat(Files.readString(backup.file())).isEqualTo("{\"serial\":1}");
    }
    
    @Test
    @DisplayName("without a local state file the backup comes from state pull")
    void backupFromStatePull() throws IOException {
        Path backupDir = workDir.resolve("backups");
        TerraformProcessRunner runner = runner(context().backupDirectory(backupDir).build());
        RemediationAction action = action();
        
        runner.apply(action, true);
        
        assertThat(calls()).contains("state pull");
        assertThat(Files.readString(action.getRollbackData().stateBackup().file())).contains("\"serial\":7");
    }
    
    @Test
    @DisplayName("no backup is taken when disabled")
    void applyWithoutBackup() throws IOException {
        TerraformProcessRunner runner = runner(context().build());
        RemediationAction action = action();
        
        runner.apply(action, false);
        
        assertThat(action.getRollbackData()).isNull();
        assertThat(calls()).doesNotContain("state pull");
    }
    
    @Test
    @DisplayName("non-zero apply exit raises with stderr and keeps the backup for rollback")
    void failedApplyKeepsBackup() throws IOException {
        Files.writeString(workDir.resolve("terraform.tfstate"), "{\"serial\":3}", StandardCharsets.UTF_8);
        TerraformProcessRunner runner = runner(context().environmentVariable("FAIL_APPLY", "1").build());
        RemediationAction action = action();
        
        assertThatThrownBy(() -> runner.apply(action))
            .isInstanceOfSatisfying(ProcessExecutionException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROCESS_FAILED);
                assertThat(e.getOperation()).isEqualTo("apply");
                assertThat(e.getExitCode()).isEqualTo(1);
                assertThat(e.getStderr()).contains("apply exploded");
            });
        
        assertThat(action.getRollbackData()).isNotNull();
        
        runner.rollback(action);
        
        Path backupFile = action.getRollbackData().stateBackup().file();
        assertThat(calls()).last().isEqualTo("state push -force " + backupFile);
        assertThat(Files.readString(workDir.resolve("pushed.tfstate"))).isEqualTo("{\"serial\":3}");
    }
    
    @Test
    @DisplayName("rollback without a recorded backup is refused")
    void rollbackWithoutBackup() {
        TerraformProcessRunner runner = runner(context().build());
        
        assertThatThrownBy(() -> runner.rollback(action()))
            .isInstanceOf(RollbackUnavailableException.class);
    }
    
    @Test
    @DisplayName("a command exceeding its timeout is killed and reported")
    void timeout() {
        TerraformProcessRunner runner = runner(context()
            .environmentVariable("SLOW_PLAN", "1")
            .commandTimeout(Duration.ofMillis(300))
            .build());
        
        assertThatThrownBy(() -> runner.plan(action()))
            .isInstanceOfSatisfying(ProcessExecutionException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROCESS_TIMEOUT));
    }
    
    @Test
    @DisplayName("a missing binary is reported as unavailable")
    void missingBinary() {
        TerraformProcessRunner runner = runner(context().binary(workDir.resolve("nope").toString()).build());
        
        assertThatThrownBy(() -> runner.plan(action()))
            .isInstanceOfSatisfying(ProcessExecutionException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROCESS_UNAVAILABLE));
    }
    
    @Test
    @DisplayName("rewriteCode edits the source and stores the new line on the action")
    void rewriteCode() throws IOException {
        Files.writeString(workDir.resolve("main.tf"), String.join("\n",
            "resource \"aws_instance\" \"web\" {",
            "  instance_type = \"t3.micro\"",
            "}",
            ""), StandardCharsets.UTF_8);
        TerraformProcessRunner runner = runner(context().build());
        RemediationAction action = action();
        
        String output = runner.rewriteCode(action);
        
        assertThat(output).contains("main.tf:2", "+ instance_type = \"t3.large\"");
        assertThat(action.getTerraformCode()).isEqualTo("  instance_type = \"t3.large\"");
        assertThat(Files.readString(workDir.resolve("main.tf"))).contains("instance_type = \"t3.large\"");
    }
    
    private TerraformContext.TerraformContextBuilder context() {
        return TerraformContext.builder()
            .binary(binary.toString())
            .workingDirectory(workDir)
            .commandTimeout(Duration.ofSeconds(20))
            .environmentVariable("CALLS_FILE", callsFile.toString());
    }
    
    private TerraformProcessRunner runner(TerraformContext context) {
        return new TerraformProcessRunner(context, new TextualHclRewriter(),
            new RemediationMetrics(meterRegistry), Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    private List<String> calls() throws IOException {
        return Files.exists(callsFile) ? Files.readAllLines(callsFile) : List.of();
    }
    
    private static RemediationAction action() {
        return RemediationAction.builder()
            .resourceName("aws_instance.web")
            .propertyPath("instance_type")
            .strategy(RemediationStrategy.TERRAFORM_APPLY)
            .severity(RemediationSeverity.HIGH_RISK)
            .currentValue("t3.large")
            .desiredValue("t3.micro")
            .build();
    }
}
