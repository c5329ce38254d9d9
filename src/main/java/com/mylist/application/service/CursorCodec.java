package com.mylist.application.service;

import com.mylist.domain.error.MyListError;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.Result;
import com.mylist.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes pagination positions as opaque, URL-safe tokens and decodes them back.
 *
 * <p>Token layout: {@code base64url(createdAt|id) + "." + base64url(truncated HMAC-SHA256)}. The signature makes
 * any edit to the token detectable, so a decoded cursor always names a position this service produced.
 */
@Component
public class CursorCodec {

    private static final Logger log = LoggerFactory.getLogger(CursorCodec.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String DEV_SECRET = "my-list-development-cursor-secret";
    private static final char FIELD_SEPARATOR = '|';
    private static final int SIGNATURE_BYTES = 12;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec key;

    public CursorCodec(AppProperties appProperties) {
        String secret = appProperties.getMyList().getCursorSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("app.my-list.cursor-secret is not set, signing cursors with the development secret");
            secret = DEV_SECRET;
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String encode(Cursor cursor) {
        byte[] payload = (cursor.createdAt().toString() + FIELD_SEPARATOR + cursor.id()).getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(sign(payload));
    }

    public Result<Cursor, MyListError.InvalidCursor> decode(String token) {
        if (token == null || token.isBlank()) {
            return Result.failure(new MyListError.InvalidCursor(token));
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.')) {
            return invalid(token, "missing signature");
        }
        try {
            byte[] payload = DECODER.decode(token.substring(0, dot));
            byte[] signature = DECODER.decode(token.substring(dot + 1));
            if (!MessageDigest.isEqual(signature, sign(payload))) {
                return invalid(token, "signature mismatch");
            }
            String decoded = new String(payload, StandardCharsets.UTF_8);
            int separator = decoded.indexOf(FIELD_SEPARATOR);
            if (separator < 0) {
                return invalid(token, "missing separator");
            }
            Instant createdAt = Instant.parse(decoded.substring(0, separator));
            UUID id = UUID.fromString(decoded.substring(separator + 1));
            return Result.success(new Cursor(createdAt, id));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return invalid(token, e.getMessage());
        }
    }

    private Result<Cursor, MyListError.InvalidCursor> invalid(String token, String reason) {
        log.warn("Invalid cursor rejected: {}", reason);
        return Result.failure(new MyListError.InvalidCursor(token));
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return Arrays.copyOf(mac.doFinal(payload), SIGNATURE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign cursor with " + HMAC_ALGORITHM, e);
        }
    }
}
