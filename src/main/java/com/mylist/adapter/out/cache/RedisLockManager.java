package com.mylist.adapter.out.cache;

import com.mylist.application.port.out.LockManager;
import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rebuild locks as {@code SET key token NX PX ttl}. Release runs as a Lua script so the token check and
 * the delete are one atomic step: a holder whose lock already expired cannot delete its successor's lock.
 */
@Repository
public class RedisLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(RedisLockManager.class);

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
        if redis.call('get', KEYS[1]) == ARGV[1] then
            return redis.call('del', KEYS[1])
        end
        return 0
        """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> tryAcquire(UserId userId, CursorSignature signature, Duration ttl) {
        String key = MyListCacheKeys.lock(userId, signature);
        String token = UUID.randomUUID().toString();
        try {
            boolean acquired = Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, token, ttl));
            log.debug("Lock {} {}", key, acquired ? "acquired" : "busy");
            return acquired ? Optional.of(token) : Optional.empty();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("lock acquire", e);
        }
    }

    @Override
    public boolean release(UserId userId, CursorSignature signature, String token) {
        String key = MyListCacheKeys.lock(userId, signature);
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
            return deleted != null && deleted > 0;
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("lock release", e);
        }
    }
}
