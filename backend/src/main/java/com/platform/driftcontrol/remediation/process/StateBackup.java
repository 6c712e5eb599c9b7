package com.platform.driftcontrol.remediation.process;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A state snapshot written before a change. The same handle names the file that was
 * written and the file a rollback restores.
 */
public record StateBackup(Path file, Instant takenAt) {
    
    public static StateBackup at(Path backupDirectory, Instant takenAt, String actionId) {
        String fileName = String.format("state-%d-%s.tfstate", takenAt.toEpochMilli(), shortId(actionId));
        return new StateBackup(backupDirectory.resolve(fileName), takenAt);
    }
    
    private static String shortId(String actionId) {
        String id = actionId == null ? "action" : actionId.replaceAll("[^A-Za-z0-9-]", "");
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
