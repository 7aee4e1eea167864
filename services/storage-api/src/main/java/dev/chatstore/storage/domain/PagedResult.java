package dev.chatstore.storage.domain;

import java.util.List;

/**
 * One page of results together with the unpaged total.
 *
 * <p>The page and the total come from two separate reads and may disagree under concurrent
 * writes.</p>
 */
public record PagedResult<T>(List<T> items, long total) {

    public PagedResult {
        items = List.copyOf(items);
    }
}
