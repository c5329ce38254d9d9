package com.mylist.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mylist.application.port.out.PageCache;
import com.mylist.domain.model.ContentType;
import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Whole page responses stored as JSON strings with a TTL. Entries under retired versions are never read
 * again and are left for Redis to expire.
 */
@Repository
public class RedisPageCache implements PageCache {

    private static final Logger log = LoggerFactory.getLogger(RedisPageCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOps;
    private final ObjectMapper objectMapper;

    public RedisPageCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.valueOps = redisTemplate.opsForValue();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Page<ListItem>> get(UserId userId, CursorSignature signature, long version) {
        String key = MyListCacheKeys.page(userId, signature, version);
        String json;
        try {
            json = valueOps.get(key);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("page get", e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, CachedPage.class).toPage());
        } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
            log.warn("Dropping unreadable cached page {}: {}", key, e.getMessage());
            evict(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(UserId userId, CursorSignature signature, long version, Page<ListItem> page, Duration ttl) {
        String key = MyListCacheKeys.page(userId, signature, version);
        String json;
        try {
            json = objectMapper.writeValueAsString(CachedPage.from(page));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Page for " + key + " is not serializable", e);
        }
        try {
            valueOps.set(key, json, ttl);
            if (signature.isFirstPage()) {
                // Kept at least as long as the page, so a live first page is always listed
                String headsKey = MyListCacheKeys.firstPageLimits(userId);
                redisTemplate.opsForSet().add(headsKey, Integer.toString(signature.limit()));
                redisTemplate.expire(headsKey, ttl);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("page put", e);
        }
        log.debug("Cached page {} ({} items, ttl={}ms)", key, page.items().size(), ttl.toMillis());
    }

    @Override
    public Set<Integer> firstPageLimits(UserId userId) {
        Set<String> members;
        try {
            members = redisTemplate.opsForSet().members(MyListCacheKeys.firstPageLimits(userId));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("first page limits", e);
        }
        if (members == null) {
            return Set.of();
        }
        Set<Integer> limits = new TreeSet<>();
        for (String member : members) {
            try {
                limits.add(Integer.parseInt(member));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed first page limit '{}' for user={}", member, userId);
            }
        }
        return limits;
    }

    private void evict(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("page evict", e);
        }
    }

    public record CachedPage(List<CachedItem> items, String nextCursor, boolean hasMore) {

        static CachedPage from(Page<ListItem> page) {
            return new CachedPage(page.items().stream().map(CachedItem::from).toList(), page.nextCursor(), page.hasMore());
        }

        Page<ListItem> toPage() {
            List<ListItem> listItems = items == null ? List.of() : items.stream().map(CachedItem::toListItem).toList();
            return new Page<>(listItems, nextCursor, hasMore);
        }
    }

    public record CachedItem(UUID id, String userId, String contentId, String contentType, Instant createdAt) {

        static CachedItem from(ListItem item) {
            return new CachedItem(item.id(), item.userId().toString(), item.contentId(),
                item.contentType().name(), item.createdAt());
        }

        ListItem toListItem() {
            return new ListItem(id, UserId.fromTrusted(userId), contentId, ContentType.valueOf(contentType), createdAt);
        }
    }
}
