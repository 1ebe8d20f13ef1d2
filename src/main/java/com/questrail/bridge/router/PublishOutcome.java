package com.questrail.bridge.router;

/**
 * Result of a publish submitted through the HTTP API.
 */
public enum PublishOutcome
{
    PUBLISHED,

    /** The link is not connected; nothing was written. */
    LINK_UNAVAILABLE,

    /** The topic was empty; nothing was written. */
    INVALID_TOPIC,

    /** The link was connected but the write failed. */
    WRITE_FAILED
}
