package com.dubbi.hostmaster.portal.traversal;

/**
 * Blocks the calling sequence until the portal courtesy interval has passed.
 */
public interface RateLimiter {
    void waitTurn();
}
