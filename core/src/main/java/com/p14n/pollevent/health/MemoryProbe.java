package com.p14n.pollevent.health;

/**
 * Reports heap usage.
 */
@FunctionalInterface
public interface MemoryProbe {

    /**
     * @return used fraction of the maximum heap, between 0 and 1
     */
    double utilization();

    static MemoryProbe runtime() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            long used = rt.totalMemory() - rt.freeMemory();
            return (double) used / rt.maxMemory();
        };
    }
}
