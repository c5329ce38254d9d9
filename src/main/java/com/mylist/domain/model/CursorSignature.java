package com.mylist.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic cache-key fragment for one query shape: the (possibly absent) cursor token plus the limit.
 * Two requests share a signature only if they would produce the same page.
 */
public record CursorSignature(String value) {

    private static final String HEAD = "head";
    private static final int DIGEST_HEX_CHARS = 16;

    public static CursorSignature firstPage(int limit) {
        return new CursorSignature("l" + limit + ":" + HEAD);
    }

    public static CursorSignature of(String cursorToken, int limit) {
        if (cursorToken == null || cursorToken.isBlank()) {
            return firstPage(limit);
        }
        return new CursorSignature("l" + limit + ":" + digest(cursorToken));
    }

    /**
     * Page size this signature was built for.
     */
    public int limit() {
        return Integer.parseInt(value.substring(1, value.indexOf(':')));
    }

    public boolean isFirstPage() {
        return value.endsWith(":" + HEAD);
    }

    private static String digest(String token) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
