package com.mylist.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected outcomes of bad client input, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be 1-64 characters of letters, digits, '-' or '_': " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    // Pagination validation errors
    sealed interface LimitError extends ValidationError {

        record NotPositive(int limit) implements LimitError {
            @Override
            public String message() {
                return "Limit must be greater than zero (was " + limit + ")";
            }

            @Override
            public String code() {
                return "LIMIT_NOT_POSITIVE";
            }
        }
    }

    // List item validation errors
    sealed interface ContentIdError extends ValidationError {

        record Empty() implements ContentIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Content ID cannot be empty";
            }

            @Override
            public String code() {
                return "CONTENT_ID_EMPTY";
            }
        }

        record TooLong(int length, int maxLength) implements ContentIdError {
            @Override
            public String message() {
                return "Content ID exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "CONTENT_ID_TOO_LONG";
            }
        }
    }
}
