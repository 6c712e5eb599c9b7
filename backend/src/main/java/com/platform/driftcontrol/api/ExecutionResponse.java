package com.platform.driftcontrol.api;

import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationResult;

import java.util.List;

public record ExecutionResponse(RemediationPlan plan, List<RemediationResult> results) {
}
