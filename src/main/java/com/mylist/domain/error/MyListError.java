package com.mylist.domain.error;

import com.mylist.domain.model.ContentType;

/**
 * Sealed type representing expected business errors of My List operations.
 * Each error is client-fixable; transient backend failures are reported through exceptions instead.
 */
public sealed interface MyListError {

    record InvalidCursor(String cursor) implements MyListError {
        @Override
        public String message() {
            return "Cursor is malformed or has been tampered with";
        }

        @Override
        public String code() {
            return "INVALID_CURSOR";
        }
    }

    record UnsupportedContentType(String contentType) implements MyListError {
        @Override
        public String message() {
            return "Unsupported content type: " + contentType + " (expected one of " + ContentType.wireNames() + ")";
        }

        @Override
        public String code() {
            return "UNSUPPORTED_CONTENT_TYPE";
        }
    }

    record ContentNotFound(String contentId, ContentType contentType) implements MyListError {
        @Override
        public String message() {
            return "No " + contentType.wireName() + " found with id " + contentId;
        }

        @Override
        public String code() {
            return "CONTENT_NOT_FOUND";
        }
    }

    /**
     * Wraps a domain validation error raised while handling the request.
     */
    record ValidationFailed(ValidationError error) implements MyListError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
