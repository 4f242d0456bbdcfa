package com.p14n.pollevent.health;

public enum HealthTier {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
