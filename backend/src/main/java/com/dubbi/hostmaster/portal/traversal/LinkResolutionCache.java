package com.dubbi.hostmaster.portal.traversal;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-traversal record of which handle keys already had their detail fetched.
 */
public class LinkResolutionCache {
    private final Set<String> fetched = new HashSet<>();

    public LinkResolutionCache() {
    }

    /**
     * Starts with keys the caller already holds, so they are never fetched.
     */
    public LinkResolutionCache(Collection<String> known) {
        if (known != null) fetched.addAll(known);
    }

    public boolean shouldFetch(String key) {
        return !fetched.contains(key);
    }

    public void markFetched(String key) {
        fetched.add(key);
    }

    public int size() {
        return fetched.size();
    }
}
