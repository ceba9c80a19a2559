package com.dubbi.hostmaster.registration.domain;

import com.dubbi.hostmaster.handle.domain.HandleDetail;
import java.util.List;

/**
 * Listing rows plus the contact handles resolved while traversing their details.
 */
public record SearchResult<T>(List<T> items, List<HandleDetail> handles) {
    public SearchResult {
        items = List.copyOf(items);
        handles = List.copyOf(handles);
    }
}
