package com.triage.service.monitor;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads utilization from the JVM's operating-system MXBean, falling back to load
 * average and heap usage when the extended bean is not available.
 */
public class JvmSystemMetricsProbe implements SystemMetricsProbe {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double cpuUtilization() {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean extended = (com.sun.management.OperatingSystemMXBean) os;
            double load = extended.getCpuLoad();
            if (load >= 0) {
                return clamp(load);
            }
        }
        double average = os.getSystemLoadAverage();
        if (average < 0) {
            return 0.0;
        }
        return clamp(average / Math.max(1, os.getAvailableProcessors()));
    }

    @Override
    public double memoryUtilization() {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean extended = (com.sun.management.OperatingSystemMXBean) os;
            long total = extended.getTotalMemorySize();
            if (total > 0) {
                return clamp(1.0 - (double) extended.getFreeMemorySize() / total);
            }
        }
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return clamp((double) used / runtime.maxMemory());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
