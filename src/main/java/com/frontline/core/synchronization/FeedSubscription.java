package com.frontline.core.synchronization;

import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.telemetry.EngineTelemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One observer's bounded outbound queue.
 *
 * offer() never blocks: when the queue is full the whole backlog is dropped, a gap
 * is flagged and the newest event is kept, so the observer sees a sequence jump and
 * can ask for a replay. Without an observer the subscription is pull-only.
 */
public final class FeedSubscription implements AutoCloseable {

    private static final long POLL_MS = 200L;
    private static final long DROP_LOG_MIN_INTERVAL_MS = 1000L;

    private final long id;
    private final ArrayBlockingQueue<FeedEvent> queue;
    private final EngineTelemetry telemetry;
    private final FeedObserver observer;
    private final Runnable onClose;

    private final AtomicBoolean gap = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private volatile long lastDropLogMs = 0L;

    private final ExecutorService dispatcher;

    FeedSubscription(long id, int capacity, EngineTelemetry telemetry, FeedObserver observer, Runnable onClose) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.telemetry = telemetry;
        this.observer = observer;
        this.onClose = onClose;

        if (observer != null) {
            this.dispatcher = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "fl-feed-" + id);
                t.setDaemon(true);
                return t;
            });
            dispatcher.execute(this::dispatchLoop);
        } else {
            this.dispatcher = null;
        }
    }

    public long id() {
        return id;
    }

    boolean offer(FeedEvent event) {
        if (closed.get()) return false;
        if (queue.offer(event)) return true;

        List<FeedEvent> backlog = new ArrayList<>();
        queue.drainTo(backlog);
        long lost = backlog.size();
        dropped.addAndGet(lost);
        if (telemetry != null) telemetry.feedEventsDropped(lost);
        gap.set(true);
        logDrop(lost);

        return queue.offer(event);
    }

    /** Pull the next event, waiting up to {@code timeout}. */
    public FeedEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public List<FeedEvent> drain() {
        List<FeedEvent> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    /** True once per overflow: reading the flag clears it. */
    public boolean consumeGap() {
        return gap.getAndSet(false);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int backlog() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void dispatchLoop() {
        while (!closed.get()) {
            FeedEvent next;
            try {
                next = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (consumeGap()) {
                try {
                    observer.onGap(this);
                } catch (Throwable t) {
                    System.err.println("[FEED] Observer " + id + " failed in onGap:");
                    t.printStackTrace();
                }
            }
            if (next == null) continue;

            try {
                observer.onEvent(next);
            } catch (Throwable t) {
                System.err.println("[FEED] Observer " + id + " failed on " + next.kind() +
                        " territory=" + next.territoryId() + " seq=" + next.sequence() + ":");
                t.printStackTrace();
            }
        }
    }

    private void logDrop(long lost) {
        long now = System.currentTimeMillis();
        if (now - lastDropLogMs < DROP_LOG_MIN_INTERVAL_MS) return;
        lastDropLogMs = now;
        System.err.println("[FEED] Subscriber " + id + " too slow: dropped backlog of " + lost +
                " events (total dropped=" + dropped.get() + ").");
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        queue.clear();
        if (onClose != null) onClose.run();
        if (dispatcher != null) {
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(1, TimeUnit.SECONDS)) {
                    dispatcher.shutdownNow();
                }
            } catch (InterruptedException e) {
                dispatcher.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
