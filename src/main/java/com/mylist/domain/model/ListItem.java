package com.mylist.domain.model;

import com.mylist.domain.error.ValidationError.ContentIdError;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * One entry of a user's list. Unique per (userId, contentId) and immutable once stored.
 * Lists are ordered by {@code createdAt} descending, with {@code id} breaking ties.
 */
public record ListItem(
    UUID id,
    UserId userId,
    String contentId,
    ContentType contentType,
    Instant createdAt
) {
    public static final int MAX_CONTENT_ID_LENGTH = 64;

    /**
     * Creates a ListItem, returning a Result for expected validation failures.
     * The timestamp is provisional: the durable store stamps the creation time from its own clock on insert
     * and hands back the stored item. It is kept at microsecond precision, the precision that store keeps.
     */
    public static Result<ListItem, ContentIdError> create(UUID id, UserId userId, String contentId, ContentType contentType) {
        Result<String, ContentIdError> validated = validateContentId(contentId);
        if (validated.isFailure()) {
            return Result.failure(validated.errorOrNull());
        }
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        return Result.success(new ListItem(id, userId, validated.getOrThrow(), contentType, now));
    }

    public static Result<String, ContentIdError> validateContentId(String contentId) {
        if (contentId == null || contentId.isBlank()) {
            return Result.failure(ContentIdError.Empty.INSTANCE);
        }
        String trimmed = contentId.trim();
        if (trimmed.length() > MAX_CONTENT_ID_LENGTH) {
            return Result.failure(new ContentIdError.TooLong(trimmed.length(), MAX_CONTENT_ID_LENGTH));
        }
        return Result.success(trimmed);
    }

    public Cursor position() {
        return new Cursor(createdAt, id);
    }
}
