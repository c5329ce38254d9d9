package com.mylist.application.service;

import com.mylist.application.port.out.VersionStore;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Users whose list changed in the store while their version could not be advanced. Until a bump succeeds
 * their cached pages still answer to the current version, so the bump is retried in the background and
 * before any read of that user on this instance.
 *
 * <p>Pending entries live in memory only; after a restart the page TTL is the remaining bound.
 */
@Component
public class VersionBumpRetrier {

    private static final Logger log = LoggerFactory.getLogger(VersionBumpRetrier.class);

    private final VersionStore versionStore;
    private final Set<UserId> pending = ConcurrentHashMap.newKeySet();

    public VersionBumpRetrier(VersionStore versionStore) {
        this.versionStore = versionStore;
    }

    public void schedule(UserId userId) {
        pending.add(userId);
    }

    /**
     * A later successful bump for the user retires every page the lost bump should have retired.
     */
    public void cancel(UserId userId) {
        pending.remove(userId);
    }

    public boolean isPending(UserId userId) {
        return pending.contains(userId);
    }

    /**
     * Bumps the user's version if a bump is owed.
     *
     * @return true when nothing is owed any more
     */
    public boolean settle(UserId userId) {
        if (!pending.contains(userId)) {
            return true;
        }
        try {
            long version = versionStore.bump(userId);
            pending.remove(userId);
            log.info("Deferred version bump applied: user={}, version={}", userId, version);
            return true;
        } catch (CacheUnavailableException e) {
            log.debug("Deferred version bump still failing for user={}: {}", userId, e.getMessage());
            return false;
        }
    }

    @Scheduled(fixedDelayString = "${app.my-list.bump-retry-interval-ms:1000}")
    public void retryPending() {
        if (pending.isEmpty()) {
            return;
        }
        log.debug("Retrying {} deferred version bumps", pending.size());
        for (UserId userId : pending) {
            if (!settle(userId)) {
                // Backend still down, the next run tries again
                return;
            }
        }
    }
}
