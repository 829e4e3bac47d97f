package com.frontline.core.synchronization;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects stalls between scheduled faction ticks (GC / STW / OS scheduling).
 *
 * A faction tick that starts much later than its cadence was delayed by something
 * outside the strategist; this prints a "[PAUSE]" line with GC deltas and heap
 * usage so a skipped decision tick can be told apart from slow scoring.
 */
public final class TickHealthMonitor {

    private final String loopName;
    private final List<GarbageCollectorMXBean> gcBeans;
    private final MemoryMXBean memoryBean;

    private final long expectedIntervalMs;
    private final long pauseThresholdMs;

    private long lastStartNs = -1L;
    private long lastGcCount = 0;
    private long lastGcTimeMs = 0;

    // Rate-limit pause logs to avoid spam
    private long lastPauseLogMs = 0L;
    private static final long PAUSE_LOG_MIN_INTERVAL_MS = 5_000L;

    public TickHealthMonitor(String loopName, long expectedIntervalMs, long pauseThresholdMs) {
        this.loopName = loopName;
        this.expectedIntervalMs = Math.max(1L, expectedIntervalMs);
        this.pauseThresholdMs = Math.max(1L, pauseThresholdMs);

        this.gcBeans = new ArrayList<>(ManagementFactory.getGarbageCollectorMXBeans());
        this.memoryBean = ManagementFactory.getMemoryMXBean();

        snapshotGcDelta();
    }

    /**
     * Call when a tick begins.
     *
     * @return milliseconds the tick started late, 0 if on time or first tick
     */
    public synchronized long onTickStart(long tick) {
        long nowNs = System.nanoTime();
        long lateMs = 0L;

        if (lastStartNs >= 0) {
            long gapMs = (nowNs - lastStartNs) / 1_000_000L;
            lateMs = Math.max(0L, gapMs - expectedIntervalMs);
            if (lateMs >= pauseThresholdMs) {
                maybeLogPause(tick, gapMs, lateMs);
            }
        }
        lastStartNs = nowNs;
        return lateMs;
    }

    private void maybeLogPause(long tick, long gapMs, long lateMs) {
        long nowMs = System.currentTimeMillis();
        if (nowMs - lastPauseLogMs < PAUSE_LOG_MIN_INTERVAL_MS) return;
        lastPauseLogMs = nowMs;

        GcDelta gc = snapshotGcDelta();
        HeapSnapshot heap = snapshotHeap();
        String kind = (gc.deltaTimeMs > 0) ? "GC" : "STALL";

        System.out.println(
                "[PAUSE] loop=" + loopName +
                        " tick=" + tick +
                        " kind=" + kind +
                        " gap=" + gapMs + "ms" +
                        " late=" + lateMs + "ms" +
                        " (expected~" + expectedIntervalMs + "ms)" +
                        " gcCountΔ=" + gc.deltaCount +
                        " gcTimeΔ=" + gc.deltaTimeMs + "ms" +
                        " heapUsed=" + heap.usedMb + "MB" +
                        " heapMax=" + heap.maxMb + "MB"
        );
    }

    private GcDelta snapshotGcDelta() {
        long c = 0;
        long t = 0;
        for (GarbageCollectorMXBean b : gcBeans) {
            long bc = b.getCollectionCount();
            long bt = b.getCollectionTime();
            if (bc > 0) c += bc;
            if (bt > 0) t += bt;
        }

        GcDelta delta = new GcDelta(c - lastGcCount, t - lastGcTimeMs);
        lastGcCount = c;
        lastGcTimeMs = t;
        return delta;
    }

    private HeapSnapshot snapshotHeap() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        return new HeapSnapshot(bytesToMb(heap.getUsed()), bytesToMb(heap.getMax()));
    }

    private static long bytesToMb(long bytes) {
        if (bytes < 0) return -1;
        return bytes / (1024L * 1024L);
    }

    private record GcDelta(long deltaCount, long deltaTimeMs) {}
    private record HeapSnapshot(long usedMb, long maxMb) {}
}
