package com.mylist.support;

import com.mylist.application.port.out.ContentCatalog;
import com.mylist.application.port.out.MyListRepository;
import com.mylist.domain.model.ContentType;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.UserId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable store and content catalog double for service-level tests.
 * Counts page queries and can slow them down to widen race windows.
 */
public class InMemoryMyListStore implements MyListRepository, ContentCatalog {

    private static final Comparator<Cursor> NEWEST_FIRST =
        Comparator.comparing(Cursor::createdAt).thenComparing(Cursor::id).reversed();

    private final List<ListItem> items = new ArrayList<>();
    private final Set<String> catalog = new HashSet<>();
    private final AtomicInteger pageQueries = new AtomicInteger();
    private volatile Duration queryDelay = Duration.ZERO;

    public synchronized void addContent(String contentId, ContentType contentType) {
        catalog.add(contentType + "/" + contentId);
    }

    public synchronized void seed(ListItem item) {
        addContent(item.contentId(), item.contentType());
        items.add(item);
    }

    public void setQueryDelay(Duration queryDelay) {
        this.queryDelay = queryDelay;
    }

    public int pageQueries() {
        return pageQueries.get();
    }

    public void resetPageQueries() {
        pageQueries.set(0);
    }

    @Override
    public synchronized boolean contentExists(String contentId, ContentType contentType) {
        return catalog.contains(contentType + "/" + contentId);
    }

    @Override
    public synchronized InsertResult insertIfAbsent(ListItem item) {
        Optional<ListItem> existing = items.stream()
            .filter(i -> i.userId().equals(item.userId()) && i.contentId().equals(item.contentId()))
            .findFirst();
        if (existing.isPresent()) {
            return new InsertResult(existing.get(), false);
        }
        items.add(item);
        return new InsertResult(item, true);
    }

    @Override
    public synchronized boolean deleteIfExists(UserId userId, String contentId) {
        return items.removeIf(i -> i.userId().equals(userId) && i.contentId().equals(contentId));
    }

    @Override
    public List<ListItem> findPage(UserId userId, Cursor cursor, int limit) {
        pageQueries.incrementAndGet();
        sleep(queryDelay);
        synchronized (this) {
            return items.stream()
                .filter(i -> i.userId().equals(userId))
                .filter(i -> cursor == null || NEWEST_FIRST.compare(i.position(), cursor) > 0)
                .sorted(Comparator.comparing(ListItem::position, NEWEST_FIRST))
                .limit(limit)
                .toList();
        }
    }

    public synchronized long count() {
        return items.size();
    }

    private static void sleep(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while simulating query latency", e);
        }
    }
}
