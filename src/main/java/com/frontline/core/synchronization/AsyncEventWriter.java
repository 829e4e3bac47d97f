package com.frontline.core.synchronization;

import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.TerritorialEventLog;
import com.frontline.core.ports.ITerritoryRepository;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Write-behind persistence for the event log, plus retention compaction.
 *
 * Also drives {@link InfluenceSaverService} on the same thread, so all storage
 * traffic leaves the simulation threads through this one writer.
 * Critical rule: NEVER touch storage inside an action.
 */
public class AsyncEventWriter implements AutoCloseable {

    private static final int BATCH_SIZE = 500;

    private final TerritorialEventLog eventLog;
    private final ITerritoryRepository repository;
    private final InfluenceSaverService saver;
    private final TerritorialConfig config;
    private final EngineTelemetry telemetry;
    private final ScheduledExecutorService writer;

    private volatile boolean started = false;

    public AsyncEventWriter(TerritorialEventLog eventLog,
                            ITerritoryRepository repository,
                            InfluenceSaverService saver,
                            TerritorialConfig config,
                            EngineTelemetry telemetry) {
        this.eventLog = eventLog;
        this.repository = repository;
        this.saver = saver;
        this.config = config;
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();

        this.writer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fl-persistence-writer");
            t.setDaemon(true);
            t.setPriority(Math.max(Thread.MIN_PRIORITY, Thread.NORM_PRIORITY - 1));
            return t;
        });
    }

    public void start() {
        if (started) return;
        started = true;
        long every = config.persistenceIntervalSeconds();
        writer.scheduleWithFixedDelay(this::flushSafely, every, every, TimeUnit.SECONDS);
        System.out.println("[PERSISTENCE] Writer started: every " + every + "s.");
    }

    private void flushSafely() {
        try {
            flushOnce();
        } catch (Throwable t) {
            System.err.println("[PERSISTENCE] Flush failed:");
            t.printStackTrace();
        }
    }

    /**
     * Events first, then influence, then compaction of already persisted events.
     *
     * @return number of events written
     */
    public int flushOnce() {
        int written = 0;
        while (true) {
            List<TerritorialEvent> batch = eventLog.unpersisted(BATCH_SIZE);
            if (batch.isEmpty()) break;
            try {
                repository.appendEvents(batch);
                eventLog.markPersisted(batch);
                written += batch.size();
            } catch (Exception ex) {
                telemetry.saveFailure();
                System.err.println("[PERSISTENCE] Event append failed for " + batch.size() + " events (kept, will retry).");
                ex.printStackTrace();
                break;
            }
            if (batch.size() < BATCH_SIZE) break;
        }

        if (saver != null) saver.autoSaveTask();

        int compacted = eventLog.compact(config.eventRetentionMinutes() * 60_000L);
        if (compacted > 0) {
            System.out.println("[PERSISTENCE] Compacted " + compacted + " persisted events past retention.");
        }
        return written;
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(2, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flushSafely();
    }
}
