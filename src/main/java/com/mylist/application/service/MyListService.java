package com.mylist.application.service;

import com.mylist.application.port.in.GetMyListUseCase;
import com.mylist.application.port.out.LockManager;
import com.mylist.application.port.out.MetricsPort;
import com.mylist.application.port.out.PageCache;
import com.mylist.application.port.out.VersionStore;
import com.mylist.domain.error.MyListError;
import com.mylist.domain.error.ValidationError;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.Result;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.config.AppProperties;
import com.mylist.infrastructure.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Read path of My List: version-tagged page cache in front of the durable store.
 *
 * <p>A page is looked up under the user's current version. On a miss one caller per (user, cursor signature)
 * rebuilds it under a lock while concurrent callers poll the cache for the result, bounded by
 * {@code lock-max-wait-ms}. When the cache backend is down every read goes straight to the store.
 */
@Service
public class MyListService implements GetMyListUseCase {

    private static final Logger log = LoggerFactory.getLogger(MyListService.class);

    private final VersionStore versionStore;
    private final PageCache pageCache;
    private final LockManager lockManager;
    private final PaginatedReader reader;
    private final CursorCodec cursorCodec;
    private final VersionBumpRetrier bumpRetrier;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public MyListService(
            VersionStore versionStore,
            PageCache pageCache,
            LockManager lockManager,
            PaginatedReader reader,
            CursorCodec cursorCodec,
            VersionBumpRetrier bumpRetrier,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.versionStore = versionStore;
        this.pageCache = pageCache;
        this.lockManager = lockManager;
        this.reader = reader;
        this.cursorCodec = cursorCodec;
        this.bumpRetrier = bumpRetrier;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Result<Page<ListItem>, MyListError> getMyList(UserId userId, String cursorToken, Integer limit) {
        log.debug("Fetching list for user={}, cursor={}, limit={}", userId, cursorToken != null ? "present" : "none", limit);

        var limitResult = resolveLimit(limit).<MyListError>mapError(MyListError.ValidationFailed::new);
        if (limitResult.isFailure()) {
            return Result.failure(limitResult.errorOrNull());
        }
        int effectiveLimit = limitResult.getOrThrow();

        Cursor cursor = null;
        if (cursorToken != null) {
            var decoded = cursorCodec.decode(cursorToken);
            if (decoded.isFailure()) {
                return Result.failure(decoded.errorOrNull());
            }
            cursor = decoded.getOrThrow();
        }

        CursorSignature signature = CursorSignature.of(cursorToken, effectiveLimit);
        Page<ListItem> page = readThroughCache(userId, cursor, signature, effectiveLimit);

        log.debug("List served: user={}, items={}, hasMore={}", userId, page.items().size(), page.hasMore());
        return Result.success(page);
    }

    private Result<Integer, ValidationError.LimitError> resolveLimit(Integer requested) {
        AppProperties.MyList config = appProperties.getMyList();
        if (requested == null) {
            return Result.success(config.getDefaultPageSize());
        }
        if (requested <= 0) {
            return Result.failure(new ValidationError.LimitError.NotPositive(requested));
        }
        return Result.success(Math.min(requested, config.getMaxPageSize()));
    }

    private Page<ListItem> readThroughCache(UserId userId, Cursor cursor, CursorSignature signature, int limit) {
        if (!bumpRetrier.settle(userId)) {
            // Cached pages under the current version predate a committed change
            log.warn("Version bump still owed, reading directly from store: user={}", userId);
            return directRead(userId, cursor, limit);
        }
        try {
            // The version must be read before the store is queried: a page built from an older snapshot
            // is then written under a version that a concurrent mutation has already retired.
            long version = versionStore.get(userId);

            Optional<Page<ListItem>> cached = pageCache.get(userId, signature, version);
            if (cached.isPresent()) {
                metrics.incrementPageCacheHits();
                log.debug("Page cache hit: user={}, signature={}, version={}", userId, signature, version);
                return cached.get();
            }
            metrics.incrementPageCacheMisses();

            Optional<String> token = lockManager.tryAcquire(userId, signature, appProperties.getMyList().lockTtl());
            if (token.isPresent()) {
                return rebuild(userId, cursor, signature, limit, version, token.get());
            }

            metrics.incrementLockBusy();
            log.debug("Rebuild already in flight: user={}, signature={}", userId, signature);
            return awaitRebuild(userId, cursor, signature, limit, version);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, reading directly from store: user={}, cause={}", userId, e.getMessage());
            return directRead(userId, cursor, limit);
        }
    }

    private Page<ListItem> rebuild(UserId userId, Cursor cursor, CursorSignature signature, int limit,
                                   long version, String token) {
        try {
            // The previous holder may have finished between our miss and our acquire
            Optional<Page<ListItem>> built = pageCache.get(userId, signature, version);
            if (built.isPresent()) {
                metrics.incrementPageCacheHits();
                return built.get();
            }
            Page<ListItem> page = metrics.recordPageRebuild(() -> reader.fetchPage(userId, cursor, limit));
            try {
                pageCache.put(userId, signature, version, page, appProperties.getMyList().pageCacheTtl());
                log.debug("Page rebuilt and cached: user={}, signature={}, version={}", userId, signature, version);
            } catch (CacheUnavailableException e) {
                log.warn("Could not cache rebuilt page for user={}: {}", userId, e.getMessage());
            }
            return page;
        } finally {
            releaseQuietly(userId, signature, token);
        }
    }

    private void releaseQuietly(UserId userId, CursorSignature signature, String token) {
        try {
            if (!lockManager.release(userId, signature, token)) {
                log.warn("Rebuild lock expired before release: user={}, signature={}", userId, signature);
            }
        } catch (CacheUnavailableException e) {
            log.warn("Could not release rebuild lock for user={}, it will expire on its own: {}", userId, e.getMessage());
        }
    }

    private Page<ListItem> awaitRebuild(UserId userId, Cursor cursor, CursorSignature signature, int limit, long version) {
        AppProperties.MyList config = appProperties.getMyList();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getLockMaxWaitMs());

        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(config.getLockPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            Optional<Page<ListItem>> cached = pageCache.get(userId, signature, version);
            if (cached.isPresent()) {
                metrics.incrementPageCacheHits();
                return cached.get();
            }
        }

        log.info("Gave up waiting for in-flight rebuild after {}ms: user={}, signature={}",
            config.getLockMaxWaitMs(), userId, signature);
        return directRead(userId, cursor, limit);
    }

    private Page<ListItem> directRead(UserId userId, Cursor cursor, int limit) {
        metrics.incrementDegradedReads();
        return reader.fetchPage(userId, cursor, limit);
    }
}
