package com.frontline.core.synchronization;

import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.ports.IFeedPublisher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of territorial notifications to any number of observers.
 *
 * Each territory is a lane with its own sequence counter and replay ring. Sequence
 * assignment and enqueueing happen under the lane monitor, so every subscriber
 * receives one territory's events in sequence order. Lanes are independent: there
 * is no global order across territories.
 */
public final class TerritorialFeed implements IFeedPublisher, AutoCloseable {

    private final int queueCapacity;
    private final int replayCapacity;
    private final EngineTelemetry telemetry;

    private final ConcurrentHashMap<Integer, Lane> lanes = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<FeedSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    public TerritorialFeed(TerritorialConfig config, EngineTelemetry telemetry) {
        this(config.feedQueueCapacity(), config.feedReplayBuffer(), telemetry);
    }

    public TerritorialFeed(int queueCapacity, int replayCapacity, EngineTelemetry telemetry) {
        this.queueCapacity = Math.max(1, queueCapacity);
        this.replayCapacity = Math.max(1, replayCapacity);
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
    }

    @Override
    public FeedEvent publish(FeedEvent event) {
        Lane lane = lanes.computeIfAbsent(event.territoryId(), k -> new Lane());
        FeedEvent sequenced;
        synchronized (lane) {
            sequenced = event.withSequence(lane.nextSequence++);
            lane.ring.addLast(sequenced);
            while (lane.ring.size() > replayCapacity) lane.ring.removeFirst();

            for (FeedSubscription s : subscriptions) {
                s.offer(sequenced);
            }
        }
        telemetry.feedEventPublished();
        return sequenced;
    }

    /** Pull-only subscription: the caller polls or drains it. */
    public FeedSubscription subscribe() {
        return register(null);
    }

    /** Push subscription: events are delivered to {@code observer} on a dedicated thread. */
    public FeedSubscription subscribe(FeedObserver observer) {
        if (observer == null) throw new IllegalArgumentException("observer is required");
        return register(observer);
    }

    private FeedSubscription register(FeedObserver observer) {
        long id = subscriptionIds.incrementAndGet();
        FeedSubscription[] holder = new FeedSubscription[1];
        FeedSubscription s = new FeedSubscription(id, queueCapacity, telemetry, observer,
                () -> subscriptions.remove(holder[0]));
        holder[0] = s;
        subscriptions.add(s);
        return s;
    }

    /**
     * Events still in the territory's replay ring with {@code sequence >= fromSequence}.
     * If the ring has already evicted part of that range the result starts later; callers
     * compare the first sequence against what they asked for.
     */
    public List<FeedEvent> replay(int territoryId, long fromSequence) {
        Lane lane = lanes.get(territoryId);
        if (lane == null) return List.of();
        List<FeedEvent> out = new ArrayList<>();
        synchronized (lane) {
            for (FeedEvent e : lane.ring) {
                if (e.sequence() >= fromSequence) out.add(e);
            }
        }
        return out;
    }

    /** Last sequence number published for the territory, 0 if none. */
    public long lastSequence(int territoryId) {
        Lane lane = lanes.get(territoryId);
        if (lane == null) return 0L;
        synchronized (lane) {
            return lane.nextSequence - 1;
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        for (FeedSubscription s : new ArrayList<>(subscriptions)) {
            s.close();
        }
        subscriptions.clear();
    }

    private static final class Lane {
        long nextSequence = 1L;
        final Deque<FeedEvent> ring = new ArrayDeque<>();
    }
}
