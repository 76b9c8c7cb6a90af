package com.myorg.normcontrol.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage timer for one analysis run. Every recorded stage is kept for the report and logged to
 * the {@code performance} logger with CPU and heap figures.
 * <p>
 * Stages may be recorded from worker threads.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");
    private static final OperatingSystemMXBean OS = ManagementFactory.getOperatingSystemMXBean();

    private final long t0 = System.nanoTime();
    private final String label;
    private final Map<String, Long> timings = Collections.synchronizedMap(new LinkedHashMap<>());

    public PerfProbe(String label) { this.label = label; }

    public static long now() {
        return System.nanoTime();
    }

    /**
     * Records a stage that started at {@code startNano} and ends now.
     *
     * @return the stage duration in milliseconds
     */
    public long record(String stage, long startNano, long unitsProcessed) {
        double ms = (System.nanoTime() - startNano) / 1_000_000.0;
        long rounded = Math.round(ms);
        timings.put(stage, rounded);

        double sec = ms / 1000.0;
        double fps = (sec > 0) ? (unitsProcessed / sec) : 0.0;

        PERF.info("{} - {} in {} ms (FPS: {}), CPU: {}%, Memory: {} MB, items={}",
                label,
                stage,
                String.format("%.2f", ms),
                String.format("%.2f", fps),
                String.format("%.1f", cpuPercent()),
                String.format("%.2f", usedMb()),
                unitsProcessed
        );
        return rounded;
    }

    /**
     * @return total wall-clock milliseconds since the probe was created
     */
    public long done() {
        double totalMs = (System.nanoTime() - t0) / 1_000_000.0;
        PERF.info("{} - total {} ms, CPU: {}%, Memory: {} MB",
                label, String.format("%.2f", totalMs),
                String.format("%.1f", cpuPercent()), String.format("%.2f", usedMb()));
        return Math.round(totalMs);
    }

    public Map<String, Long> timings() {
        synchronized (timings) {
            return new LinkedHashMap<>(timings);
        }
    }

    private static double cpuPercent() {
        if (OS instanceof com.sun.management.OperatingSystemMXBean m) {
            double load = m.getProcessCpuLoad();
            return load < 0 ? 0.0 : load * 100.0;
        }
        return 0.0;
    }

    private static double usedMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
    }
}
