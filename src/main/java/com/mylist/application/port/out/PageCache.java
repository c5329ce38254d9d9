package com.mylist.application.port.out;

import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.UserId;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Serialized page responses keyed by (user, cursor signature, version).
 * Implementations throw {@link com.mylist.infrastructure.exception.CacheUnavailableException} when the backend fails.
 */
public interface PageCache {
    Optional<Page<ListItem>> get(UserId userId, CursorSignature signature, long version);

    /**
     * Stores the page. Caching a first page also records its limit for {@link #firstPageLimits(UserId)}.
     */
    void put(UserId userId, CursorSignature signature, long version, Page<ListItem> page, Duration ttl);

    /**
     * Limits of the first pages cached for the user, under any version. The set may name pages that have since
     * expired; it never misses a limit whose first page is still cached.
     */
    Set<Integer> firstPageLimits(UserId userId);
}
