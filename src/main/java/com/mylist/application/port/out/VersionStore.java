package com.mylist.application.port.out;

import com.mylist.domain.model.UserId;

/**
 * Per-user list version. Every page-cache key embeds it, so advancing it retires all cached pages at once.
 * Implementations throw {@link com.mylist.infrastructure.exception.CacheUnavailableException} when the backend fails.
 */
public interface VersionStore {

    long INITIAL_VERSION = 1L;

    /**
     * Current version, created as {@link #INITIAL_VERSION} on first access.
     */
    long get(UserId userId);

    /**
     * Atomically increments the version and returns the new value.
     */
    long bump(UserId userId);
}
