package com.triage.service.monitor;

/**
 * Source of host resource utilization.
 */
public interface SystemMetricsProbe {

    /**
     * CPU utilization in [0, 1].
     */
    double cpuUtilization();

    /**
     * Memory utilization in [0, 1].
     */
    double memoryUtilization();
}
