package com.mylist.domain.model;

import java.util.List;

public record Page<T>(
    List<T> items,
    String nextCursor,
    boolean hasMore
) {
    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static <T> Page<T> of(List<T> items, String nextCursor) {
        return new Page<>(items, nextCursor, nextCursor != null);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), null, false);
    }
}
