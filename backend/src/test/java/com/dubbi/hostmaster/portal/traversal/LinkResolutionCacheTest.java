package com.dubbi.hostmaster.portal.traversal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LinkResolutionCacheTest {

    @Test
    void keyIsFetchedOnlyUntilMarked() {
        LinkResolutionCache cache = new LinkResolutionCache();
        assertTrue(cache.shouldFetch("AD001JP"));
        cache.markFetched("AD001JP");
        cache.markFetched("AD001JP");
        assertFalse(cache.shouldFetch("AD001JP"));
        assertEquals(1, cache.size());
    }

    @Test
    void seededKeysAreNeverFetched() {
        LinkResolutionCache cache = new LinkResolutionCache(List.of("TE001JP"));
        assertFalse(cache.shouldFetch("TE001JP"));
        assertTrue(cache.shouldFetch("AD001JP"));
    }
}
