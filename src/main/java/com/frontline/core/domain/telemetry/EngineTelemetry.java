package com.frontline.core.domain.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for the territorial engine.
 *
 * THREADING NOTES:
 * - Incremented from action threads, feed dispatchers and scheduled tasks.
 * - AtomicLong only, no locks: the counters never gate simulation work.
 */
public final class EngineTelemetry {

    private final AtomicLong actionsApplied = new AtomicLong();
    private final AtomicLong actionsRejected = new AtomicLong();
    private final AtomicLong controlFlips = new AtomicLong();
    private final AtomicLong cascadesRun = new AtomicLong();
    private final AtomicLong cascadeDeltasApplied = new AtomicLong();
    private final AtomicLong cascadesTruncated = new AtomicLong();
    private final AtomicLong decaySweeps = new AtomicLong();
    private final AtomicLong decisionTicksSkipped = new AtomicLong();
    private final AtomicLong feedEventsPublished = new AtomicLong();
    private final AtomicLong feedEventsDropped = new AtomicLong();
    private final AtomicLong saveFailures = new AtomicLong();

    public void actionApplied() { actionsApplied.incrementAndGet(); }
    public void actionRejected() { actionsRejected.incrementAndGet(); }
    public void controlFlip() { controlFlips.incrementAndGet(); }
    public void cascadeRun() { cascadesRun.incrementAndGet(); }
    public void cascadeDeltaApplied() { cascadeDeltasApplied.incrementAndGet(); }
    public void cascadeTruncated() { cascadesTruncated.incrementAndGet(); }
    public void decaySweep() { decaySweeps.incrementAndGet(); }
    public void decisionTickSkipped() { decisionTicksSkipped.incrementAndGet(); }
    public void feedEventPublished() { feedEventsPublished.incrementAndGet(); }
    public void feedEventsDropped(long count) { if (count > 0) feedEventsDropped.addAndGet(count); }
    public void saveFailure() { saveFailures.incrementAndGet(); }

    public long getActionsApplied() { return actionsApplied.get(); }
    public long getActionsRejected() { return actionsRejected.get(); }
    public long getControlFlips() { return controlFlips.get(); }
    public long getCascadesRun() { return cascadesRun.get(); }
    public long getCascadeDeltasApplied() { return cascadeDeltasApplied.get(); }
    public long getCascadesTruncated() { return cascadesTruncated.get(); }
    public long getDecaySweeps() { return decaySweeps.get(); }
    public long getDecisionTicksSkipped() { return decisionTicksSkipped.get(); }
    public long getFeedEventsPublished() { return feedEventsPublished.get(); }
    public long getFeedEventsDropped() { return feedEventsDropped.get(); }
    public long getSaveFailures() { return saveFailures.get(); }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("actions_applied", getActionsApplied());
        out.put("actions_rejected", getActionsRejected());
        out.put("control_flips", getControlFlips());
        out.put("cascades_run", getCascadesRun());
        out.put("cascade_deltas_applied", getCascadeDeltasApplied());
        out.put("cascades_truncated", getCascadesTruncated());
        out.put("decay_sweeps", getDecaySweeps());
        out.put("decision_ticks_skipped", getDecisionTicksSkipped());
        out.put("feed_events_published", getFeedEventsPublished());
        out.put("feed_events_dropped", getFeedEventsDropped());
        out.put("save_failures", getSaveFailures());
        return out;
    }
}
