package com.frontline.core.synchronization;

import com.frontline.core.domain.feed.FeedEvent;

/**
 * Push-style consumer of the territorial feed. Called from the subscription's own
 * dispatcher thread, never from the thread that produced the event.
 */
public interface FeedObserver {

    void onEvent(FeedEvent event);

    /**
     * Backlog was dropped because this observer fell behind. The next events may skip
     * sequence numbers; use {@link TerritorialFeed#replay(int, long)} to fill the hole.
     */
    default void onGap(FeedSubscription subscription) {
    }
}
