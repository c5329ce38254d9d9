package com.mylist.domain.model;

import com.mylist.domain.error.ValidationError.UserIdError;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Value Object for User identity.
 * The value is embedded verbatim in cache keys, so the character set excludes the ':' key separator.
 */
public record UserId(String value) {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public UserId {
        // Compact constructor for internal use - assumes validated input
        if (value == null) {
            throw new IllegalStateException("UserId value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a string into a UserId, returning a Result for expected validation failures.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (!VALID.matcher(trimmed).matches()) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
        return Result.success(new UserId(trimmed));
    }

    /**
     * Creates a UserId from a trusted source (e.g., database rows, cached pages).
     * For external/user input, use parse() instead.
     *
     * @throws IllegalStateException if the value is not a valid user id (indicates data corruption)
     */
    public static UserId fromTrusted(String value) {
        if (value == null || !VALID.matcher(value).matches()) {
            throw new IllegalStateException("Corrupted UserId in trusted source: " + value);
        }
        return new UserId(value);
    }

    /**
     * Creates a random UserId. Useful for tests.
     */
    public static UserId random() {
        return new UserId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
