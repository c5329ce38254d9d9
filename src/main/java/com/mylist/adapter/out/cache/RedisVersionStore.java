package com.mylist.adapter.out.cache;

import com.mylist.application.port.out.VersionStore;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.CacheUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Repository;

/**
 * Version counters as plain Redis integers. The key carries no TTL: letting it expire would restart the
 * counter at a value under which pages may still be cached.
 */
@Repository
public class RedisVersionStore implements VersionStore {

    private static final String INITIAL = Long.toString(INITIAL_VERSION);

    private final ValueOperations<String, String> valueOps;

    public RedisVersionStore(StringRedisTemplate redisTemplate) {
        this.valueOps = redisTemplate.opsForValue();
    }

    @Override
    public long get(UserId userId) {
        String key = MyListCacheKeys.version(userId);
        try {
            // SETNX decides the race between concurrent first readers
            if (Boolean.TRUE.equals(valueOps.setIfAbsent(key, INITIAL))) {
                return INITIAL_VERSION;
            }
            String current = valueOps.get(key);
            return current != null ? Long.parseLong(current) : INITIAL_VERSION;
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("version get", e);
        }
    }

    @Override
    public long bump(UserId userId) {
        String key = MyListCacheKeys.version(userId);
        try {
            // INCR on a missing key would yield the initial version itself, so initialize first
            valueOps.setIfAbsent(key, INITIAL);
            Long bumped = valueOps.increment(key);
            if (bumped == null) {
                throw new CacheUnavailableException("version bump", new IllegalStateException("INCR returned no value"));
            }
            return bumped;
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("version bump", e);
        }
    }
}
