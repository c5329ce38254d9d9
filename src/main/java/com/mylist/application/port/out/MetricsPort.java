package com.mylist.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementPageCacheHits();

    void incrementPageCacheMisses();

    void incrementLockBusy();

    void incrementDegradedReads();

    void incrementOptimisticPatches();

    void incrementItemsAdded();

    void incrementItemsRemoved();

    <T> T recordPageRebuild(Supplier<T> operation);
}
