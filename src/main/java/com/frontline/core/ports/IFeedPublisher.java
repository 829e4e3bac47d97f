package com.frontline.core.ports;

import com.frontline.core.domain.feed.FeedEvent;

/**
 * Outbound channel for territorial notifications.
 * Implementations must not block the caller: publish runs under a territory lock.
 */
public interface IFeedPublisher {

    /** @return the event as published, with its per-territory sequence number */
    FeedEvent publish(FeedEvent event);
}
