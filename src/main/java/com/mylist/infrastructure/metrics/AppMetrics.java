package com.mylist.infrastructure.metrics;

import com.mylist.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter pageCacheHits;
    private final Counter pageCacheMisses;
    private final Counter lockBusy;
    private final Counter degradedReads;
    private final Counter optimisticPatches;
    private final Counter itemsAdded;
    private final Counter itemsRemoved;
    private final Timer pageRebuildDuration;

    public AppMetrics(MeterRegistry registry) {
        this.pageCacheHits = Counter.builder("my_list_page_cache_hits_total")
            .description("Page reads served from the page cache")
            .register(registry);

        this.pageCacheMisses = Counter.builder("my_list_page_cache_misses_total")
            .description("Page reads that found no page under the current version")
            .register(registry);

        this.lockBusy = Counter.builder("my_list_rebuild_lock_busy_total")
            .description("Cold reads that found another rebuild in flight")
            .register(registry);

        this.degradedReads = Counter.builder("my_list_degraded_reads_total")
            .description("Reads served directly from the store because the cache was down or the wait cap was hit")
            .register(registry);

        this.optimisticPatches = Counter.builder("my_list_optimistic_patches_total")
            .description("First pages patched in place after an add")
            .register(registry);

        this.itemsAdded = Counter.builder("my_list_items_added_total")
            .description("Items newly added to a list")
            .register(registry);

        this.itemsRemoved = Counter.builder("my_list_items_removed_total")
            .description("Items removed from a list")
            .register(registry);

        this.pageRebuildDuration = Timer.builder("my_list_page_rebuild_duration_seconds")
            .description("Time taken to build a page from the durable store")
            .register(registry);
    }

    @Override
    public void incrementPageCacheHits() {
        pageCacheHits.increment();
    }

    @Override
    public void incrementPageCacheMisses() {
        pageCacheMisses.increment();
    }

    @Override
    public void incrementLockBusy() {
        lockBusy.increment();
    }

    @Override
    public void incrementDegradedReads() {
        degradedReads.increment();
    }

    @Override
    public void incrementOptimisticPatches() {
        optimisticPatches.increment();
    }

    @Override
    public void incrementItemsAdded() {
        itemsAdded.increment();
    }

    @Override
    public void incrementItemsRemoved() {
        itemsRemoved.increment();
    }

    @Override
    public <T> T recordPageRebuild(Supplier<T> operation) {
        return pageRebuildDuration.record(operation);
    }
}
