package com.platform.driftcontrol.remediation.process;

import com.platform.driftcontrol.error.ErrorCode;
import com.platform.driftcontrol.error.ProcessExecutionException;
import com.platform.driftcontrol.error.RollbackUnavailableException;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RollbackData;
import com.platform.driftcontrol.remediation.process.source.SourceRewrite;
import com.platform.driftcontrol.remediation.process.source.SourceRewriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the terraform CLI in the configured working directory.
 * 
 * Operations that change state or source (apply, rewrite, rollback) are serialized
 * so concurrent actions never interleave writes to the same state.
 */
@Slf4j
public class TerraformProcessRunner implements ProcessRunner {
    
    private static final String OP_PLAN = "plan";
    private static final String OP_APPLY = "apply";
    private static final String OP_BACKUP = "backup";
    private static final String OP_ROLLBACK = "rollback";
    
    private final TerraformContext context;
    private final SourceRewriter sourceRewriter;
    private final RemediationMetrics metrics;
    private final Clock clock;
    private final ReentrantLock mutationLock = new ReentrantLock();
    
    public TerraformProcessRunner(TerraformContext context, SourceRewriter sourceRewriter,
                                  RemediationMetrics metrics, Clock clock) {
        this.context = context;
        this.sourceRewriter = sourceRewriter;
        this.metrics = metrics;
        this.clock = clock;
    }
    
    @Override
    public String plan(RemediationAction action) {
        List<String> args = new ArrayList<>(List.of("plan", "-no-color", "-input=false"));
        addScope(args, action);
        return runCommand(OP_PLAN, args).stdout();
    }
    
    @Override
    public String apply(RemediationAction action, boolean backupBeforeChange) {
        mutationLock.lock();
        try {
            String planOutput = plan(action);
            
            if (backupBeforeChange) {
                backupState(action).ifPresent(backup -> action.setRollbackData(new RollbackData(backup)));
            }
            
            List<String> args = new ArrayList<>(List.of("apply", "-auto-approve", "-no-color", "-input=false"));
            addScope(args, action);
            String applyOutput = runCommand(OP_APPLY, args).stdout();
            
            log.info("Applied terraform change for {}", action.getResourceName());
            return "Plan:\n" + planOutput + "\n\nApply:\n" + applyOutput;
        } finally {
            mutationLock.unlock();
        }
    }
    
    @Override
    public String rewriteCode(RemediationAction action) {
        mutationLock.lock();
        try {
            SourceRewrite rewrite = sourceRewriter.rewrite(context.getWorkingDirectory(), action);
            action.setTerraformCode(rewrite.after());
            log.info("Rewrote {} to match live value of {}", rewrite.file(), action.getPropertyPath());
            return rewrite.describe();
        } finally {
            mutationLock.unlock();
        }
    }
    
    @Override
    public void rollback(RemediationAction action) {
        RollbackData rollbackData = action.getRollbackData();
        if (rollbackData == null || rollbackData.stateBackup() == null) {
            throw new RollbackUnavailableException(action.getId());
        }
        
        Path backupFile = rollbackData.stateBackup().file();
        if (!Files.isRegularFile(backupFile)) {
            throw new RollbackUnavailableException(action.getId());
        }
        
        mutationLock.lock();
        try {
            runCommand(OP_ROLLBACK, List.of("state", "push", "-force", backupFile.toString()));
            log.info("Restored state for {} from {}", action.getResourceName(), backupFile);
        } finally {
            mutationLock.unlock();
        }
    }
    
    /**
     * Snapshot current state. A missing local state file falls back to {@code terraform state pull}.
     * Failures are logged and yield no backup; the apply still proceeds.
     */
    Optional<StateBackup> backupState(RemediationAction action) {
        StateBackup backup = StateBackup.at(context.resolvedBackupDirectory(), clock.instant(), action.getId());
        try {
            Files.createDirectories(backup.file().getParent());
            Path stateFile = context.resolvedStateFile();
            if (Files.isRegularFile(stateFile)) {
                Files.copy(stateFile, backup.file(), StandardCopyOption.REPLACE_EXISTING);
            } else {
                String pulled = runCommand(OP_BACKUP, List.of("state", "pull")).stdout();
                Files.writeString(backup.file(), pulled, StandardCharsets.UTF_8);
            }
            log.info("State backed up to {}", backup.file());
            return Optional.of(backup);
        } catch (IOException | ProcessExecutionException e) {
            log.warn("Could not back up state before changing {}: {}", action.getResourceName(), e.getMessage());
            return Optional.empty();
        }
    }
    
    private void addScope(List<String> args, RemediationAction action) {
        if (context.getVarFile() != null && !context.getVarFile().isBlank()) {
            args.add("-var-file=" + context.getVarFile());
        }
        args.add("-target=" + action.getResourceName());
    }
    
    /**
     * Run one terraform command, capturing both streams. Output is redirected to
     * temporary files so a chatty process can never block on a full pipe.
     */
    CommandResult runCommand(String operation, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(context.getBinary());
        command.addAll(args);
        
        log.debug("Running [{}] in {}", String.join(" ", command), context.getWorkingDirectory());
        long start = clock.millis();
        
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("terraform-" + operation + "-", ".out");
            stderrFile = Files.createTempFile("terraform-" + operation + "-", ".err");
            
            ProcessBuilder processBuilder = new ProcessBuilder(command)
                .directory(context.getWorkingDirectory().toFile())
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());
            processBuilder.environment().putAll(context.getEnvironment());
            processBuilder.environment().put("TF_IN_AUTOMATION", "1");
            
            process = processBuilder.start();
            
            long timeoutMillis = context.getCommandTimeout().toMillis();
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                metrics.recordProcessInvocation(operation, -1, clock.millis() - start);
                throw ProcessExecutionException.timedOut(operation, context.getCommandTimeout().toSeconds());
            }
            
            int exitCode = process.exitValue();
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            long duration = clock.millis() - start;
            
            stdout.lines().forEach(line -> log.debug("[terraform] {}", line));
            metrics.recordProcessInvocation(operation, exitCode, duration);
            
            if (exitCode != 0) {
                log.error("Terraform {} exited with {}: {}", operation, exitCode, stderr.strip());
                throw ProcessExecutionException.nonZeroExit(operation, exitCode, stderr);
            }
            return new CommandResult(exitCode, stdout, stderr, duration);
            
        } catch (IOException e) {
            throw ProcessExecutionException.startFailed(operation, context.getBinary(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ProcessExecutionException(ErrorCode.PROCESS_FAILED, operation,
                "Interrupted while waiting for terraform " + operation, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }
    
    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
