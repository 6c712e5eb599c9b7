package com.platform.driftcontrol.remediation;

import com.platform.driftcontrol.remediation.process.StateBackup;

/**
 * What a failed action needs to be rolled back. Only ever created from a backup that was written.
 */
public record RollbackData(StateBackup stateBackup) {
}
