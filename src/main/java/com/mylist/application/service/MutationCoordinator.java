package com.mylist.application.service;

import com.mylist.application.port.in.AddToMyListUseCase;
import com.mylist.application.port.in.RemoveFromMyListUseCase;
import com.mylist.application.port.out.ContentCatalog;
import com.mylist.application.port.out.IdGenerator;
import com.mylist.application.port.out.MetricsPort;
import com.mylist.application.port.out.MyListRepository;
import com.mylist.application.port.out.MyListRepository.InsertResult;
import com.mylist.application.port.out.PageCache;
import com.mylist.application.port.out.VersionStore;
import com.mylist.domain.error.MyListError;
import com.mylist.domain.model.ContentType;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Write path of My List. Mutates the durable store, then advances the user's version so every cached page
 * becomes unreachable. After an add the cached first page of the previous version, when there is one, is
 * patched and carried over to the new version instead of being rebuilt.
 *
 * <p>Removes are never patched: a removal can move the boundary between any two pages.
 *
 * <p>Methods are not transactional: the version may only advance once the store change is committed,
 * otherwise a reader could cache a pre-commit snapshot under the new version.
 */
@Service
public class MutationCoordinator implements AddToMyListUseCase, RemoveFromMyListUseCase {

    private static final Logger log = LoggerFactory.getLogger(MutationCoordinator.class);

    private final MyListRepository repository;
    private final ContentCatalog contentCatalog;
    private final VersionStore versionStore;
    private final PageCache pageCache;
    private final CursorCodec cursorCodec;
    private final IdGenerator idGenerator;
    private final VersionBumpRetrier bumpRetrier;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public MutationCoordinator(
            MyListRepository repository,
            ContentCatalog contentCatalog,
            VersionStore versionStore,
            PageCache pageCache,
            CursorCodec cursorCodec,
            IdGenerator idGenerator,
            VersionBumpRetrier bumpRetrier,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.repository = repository;
        this.contentCatalog = contentCatalog;
        this.versionStore = versionStore;
        this.pageCache = pageCache;
        this.cursorCodec = cursorCodec;
        this.idGenerator = idGenerator;
        this.bumpRetrier = bumpRetrier;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Result<AddedItem, MyListError> addItem(UserId userId, String contentId, String contentType) {
        log.debug("Adding to list: user={}, contentId={}, contentType={}", userId, contentId, contentType);

        Optional<ContentType> type = ContentType.fromWireName(contentType);
        if (type.isEmpty()) {
            log.warn("Add rejected for user={}: unsupported content type {}", userId, contentType);
            return Result.failure(new MyListError.UnsupportedContentType(contentType));
        }

        var itemResult = ListItem.create(idGenerator.generate(), userId, contentId, type.get())
            .<MyListError>mapError(MyListError.ValidationFailed::new);
        if (itemResult.isFailure()) {
            return Result.failure(itemResult.errorOrNull());
        }
        ListItem candidate = itemResult.getOrThrow();

        if (!contentCatalog.contentExists(candidate.contentId(), candidate.contentType())) {
            log.warn("Add rejected for user={}: {} {} does not exist", userId, contentType, candidate.contentId());
            return Result.failure(new MyListError.ContentNotFound(candidate.contentId(), candidate.contentType()));
        }

        InsertResult inserted = repository.insertIfAbsent(candidate);
        ListItem item = inserted.item();

        OptionalLong newVersion = bumpVersion(userId);
        if (inserted.inserted()) {
            metrics.incrementItemsAdded();
            newVersion.ifPresent(version -> patchFirstPages(userId, item, version));
            log.info("Item added: user={}, contentId={}, itemId={}", userId, item.contentId(), item.id());
        } else {
            log.info("Item already in list: user={}, contentId={}", userId, item.contentId());
        }

        return Result.success(new AddedItem(item, inserted.inserted()));
    }

    @Override
    public Result<Boolean, MyListError> removeItem(UserId userId, String contentId) {
        var contentIdResult = ListItem.validateContentId(contentId)
            .<MyListError>mapError(MyListError.ValidationFailed::new);
        if (contentIdResult.isFailure()) {
            return Result.failure(contentIdResult.errorOrNull());
        }

        boolean deleted = repository.deleteIfExists(userId, contentIdResult.getOrThrow());
        if (!deleted) {
            // Nothing visible changed, so cached pages stay valid
            log.debug("Remove was a no-op: user={}, contentId={}", userId, contentId);
            return Result.success(false);
        }

        bumpVersion(userId);
        metrics.incrementItemsRemoved();
        log.info("Item removed: user={}, contentId={}", userId, contentIdResult.getOrThrow());
        return Result.success(true);
    }

    /**
     * Advances the user's version.
     *
     * @return the new version when pages under its predecessor reflect every earlier change, empty otherwise
     */
    private OptionalLong bumpVersion(UserId userId) {
        boolean owed = bumpRetrier.isPending(userId);
        try {
            long version = versionStore.bump(userId);
            bumpRetrier.cancel(userId);
            log.debug("Version bumped: user={}, version={}", userId, version);
            // Pages under the previous version missed the change whose bump was lost
            return owed ? OptionalLong.empty() : OptionalLong.of(version);
        } catch (CacheUnavailableException e) {
            // The store change stands; the bump is owed until the cache backend takes it
            log.error("Version bump failed for user={}, retrying in the background: {}", userId, e.getMessage());
            bumpRetrier.schedule(userId);
            return OptionalLong.empty();
        }
    }

    private void patchFirstPages(UserId userId, ListItem added, long newVersion) {
        try {
            for (int limit : pageCache.firstPageLimits(userId)) {
                CursorSignature signature = CursorSignature.firstPage(limit);
                Optional<Page<ListItem>> previous = pageCache.get(userId, signature, newVersion - 1);
                if (previous.isEmpty()) {
                    continue;
                }
                Page<ListItem> patched = prepend(previous.get(), added, limit);
                pageCache.put(userId, signature, newVersion, patched, appProperties.getMyList().pageCacheTtl());
                metrics.incrementOptimisticPatches();
                log.debug("First page patched in place: user={}, limit={}, version={}", userId, limit, newVersion);
            }
        } catch (CacheUnavailableException e) {
            log.warn("Skipping first-page patch for user={}, next read rebuilds it: {}", userId, e.getMessage());
        }
    }

    Page<ListItem> prepend(Page<ListItem> previous, ListItem added, int limit) {
        List<ListItem> items = new ArrayList<>(limit + 1);
        items.add(added);
        for (ListItem existing : previous.items()) {
            // A reader may have cached a snapshot that already contains the new row
            if (!existing.contentId().equals(added.contentId())) {
                items.add(existing);
            }
        }

        boolean overflowed = items.size() > limit;
        if (overflowed) {
            items = items.subList(0, limit);
        }
        boolean hasMore = overflowed || previous.hasMore();
        String nextCursor = hasMore ? cursorCodec.encode(items.get(items.size() - 1).position()) : null;
        return new Page<>(items, nextCursor, hasMore);
    }
}
