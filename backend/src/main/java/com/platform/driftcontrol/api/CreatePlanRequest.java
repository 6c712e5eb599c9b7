package com.platform.driftcontrol.api;

import com.platform.driftcontrol.drift.DriftResult;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code POST /api/remediation/plans}.
 */
public record CreatePlanRequest(
    @NotBlank String scanId,
    @NotNull List<DriftResult> driftResults
) {
}
