package com.mylist.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Ordering position of the last item seen on a page. The next page starts strictly after it.
 */
public record Cursor(Instant createdAt, UUID id) {

    public Cursor {
        if (createdAt == null || id == null) {
            throw new IllegalArgumentException("Cursor requires both createdAt and id");
        }
    }
}
