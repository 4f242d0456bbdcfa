package com.p14n.pollevent.health;

import java.time.Instant;
import java.util.List;

import com.p14n.pollevent.buffer.EvictionResult;

/**
 * Derived health of the monitoring pipeline at one point in time.
 *
 * @param tier              overall tier
 * @param errorCount        errors recorded since start or the last reset
 * @param lastError         most recent error, or {@code null}
 * @param mitigations       active recovery actions, e.g. {@code spillover-disabled}
 * @param issues            reasons the tier is not healthy
 * @param bufferUtilization occupied fraction of the event buffer
 * @param memoryUtilization used fraction of the heap
 * @param lastEviction      most recent emergency eviction, or {@code null}
 * @param checkedAt         when the status was computed
 */
public record HealthStatus(HealthTier tier,
        long errorCount,
        ErrorRecord lastError,
        List<String> mitigations,
        List<String> issues,
        double bufferUtilization,
        double memoryUtilization,
        EvictionResult lastEviction,
        Instant checkedAt) {

    public HealthStatus {
        mitigations = List.copyOf(mitigations);
        issues = List.copyOf(issues);
    }

    public boolean healthy() {
        return tier == HealthTier.HEALTHY;
    }
}
