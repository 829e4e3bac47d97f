package com.frontline.core.managers;

import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.TerritorialEvent;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * In-memory append-only event log.
 *
 * Ids are assigned under the log monitor, so iteration order is id order even
 * when different territories append concurrently. Events leave memory only
 * through {@link #compact}, and only once they have been persisted.
 */
public final class TerritorialEventLog {

    private final Clock clock;
    private final Deque<TerritorialEvent> events = new ArrayDeque<>();

    private long nextId;
    private long persistedUpToId;

    public TerritorialEventLog(Clock clock) {
        this(clock, 0L);
    }

    /**
     * @param lastKnownId highest id already stored, so ids keep increasing across restarts
     */
    public TerritorialEventLog(Clock clock, long lastKnownId) {
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.nextId = Math.max(0L, lastKnownId) + 1L;
        this.persistedUpToId = Math.max(0L, lastKnownId);
    }

    public synchronized TerritorialEvent append(int territoryId,
                                                int factionId,
                                                String actorId,
                                                String sessionId,
                                                EventCause cause,
                                                double requestedDelta,
                                                double appliedDelta,
                                                double resultingValue,
                                                EventPriority priority,
                                                boolean controlChanged,
                                                int cascadeWave) {
        TerritorialEvent e = new TerritorialEvent(
                nextId++,
                clock.millis(),
                territoryId,
                factionId,
                actorId,
                sessionId,
                cause,
                requestedDelta,
                appliedDelta,
                resultingValue,
                priority,
                controlChanged,
                cascadeWave
        );
        events.addLast(e);
        return e;
    }

    public synchronized List<TerritorialEvent> all() {
        return new ArrayList<>(events);
    }

    public synchronized List<TerritorialEvent> forTerritory(int territoryId) {
        List<TerritorialEvent> out = new ArrayList<>();
        for (TerritorialEvent e : events) {
            if (e.territoryId() == territoryId) out.add(e);
        }
        return out;
    }

    /** Events not yet handed to storage, oldest first, at most {@code limit}. */
    public synchronized List<TerritorialEvent> unpersisted(int limit) {
        List<TerritorialEvent> out = new ArrayList<>();
        for (TerritorialEvent e : events) {
            if (e.id() <= persistedUpToId) continue;
            out.add(e);
            if (out.size() >= limit) break;
        }
        return out;
    }

    public synchronized void markPersisted(Collection<TerritorialEvent> batch) {
        for (TerritorialEvent e : batch) {
            if (e.id() > persistedUpToId) persistedUpToId = e.id();
        }
    }

    public synchronized long persistedUpToId() {
        return persistedUpToId;
    }

    /**
     * Drops persisted events older than {@code retentionMs}.
     *
     * @return number of events removed
     */
    public synchronized int compact(long retentionMs) {
        long cutoff = clock.millis() - retentionMs;
        int removed = 0;
        while (!events.isEmpty()) {
            TerritorialEvent head = events.peekFirst();
            if (head.id() > persistedUpToId || head.timestampMs() >= cutoff) break;
            events.removeFirst();
            removed++;
        }
        return removed;
    }

    public synchronized int size() {
        return events.size();
    }
}
