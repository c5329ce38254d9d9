package com.mylist.infrastructure.exception;

/**
 * The cache/lock backend failed or timed out. Read paths degrade to direct store reads when they see this.
 */
public class CacheUnavailableException extends BusinessException {

    public CacheUnavailableException(String operation, Throwable cause) {
        super("CACHE_UNAVAILABLE", "Cache backend unavailable during " + operation, cause);
    }
}
