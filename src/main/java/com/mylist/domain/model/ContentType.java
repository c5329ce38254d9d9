package com.mylist.domain.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Kinds of content a user can keep in their list.
 */
public enum ContentType {
    MOVIE("movie"),
    TV_SHOW("tvshow");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ContentType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(value.trim()))
            .findFirst();
    }

    public static String wireNames() {
        return Arrays.stream(values()).map(ContentType::wireName).collect(Collectors.joining(", "));
    }
}
