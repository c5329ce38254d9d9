package com.mylist.application.port.out;

import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.UserId;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived, self-expiring mutual exclusion per (user, cursor signature), used to serialize cold page rebuilds
 * across service instances.
 * Implementations throw {@link com.mylist.infrastructure.exception.CacheUnavailableException} when the backend fails.
 */
public interface LockManager {

    /**
     * Atomically takes the lock if nobody holds it.
     *
     * @return the holder token, or empty if another holder is rebuilding
     */
    Optional<String> tryAcquire(UserId userId, CursorSignature signature, Duration ttl);

    /**
     * Releases the lock only if it is still held under {@code token}.
     *
     * @return true if the lock was deleted
     */
    boolean release(UserId userId, CursorSignature signature, String token);
}
