package com.restaurantguide.search.application.pagination;

import com.restaurantguide.search.domain.model.SearchCursor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes pagination cursors as opaque, signed tokens.
 *
 * Layout (49 bytes, then base64url without padding):
 * <pre>
 * version(1) | score in micro-units(8) | id(16) | filter fingerprint(8) | HMAC-SHA256 tag(16)
 * </pre>
 *
 * The tag covers the first 33 bytes, so a cursor edited by a client fails to decode.
 */
@Component
public class CursorCodec {

    static final byte VERSION = 1;
    static final int PAYLOAD_LENGTH = 1 + 8 + 16 + 8;
    static final int TAG_LENGTH = 16;
    static final int TOKEN_LENGTH = PAYLOAD_LENGTH + TAG_LENGTH;

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public CursorCodec(@Value("${app.search.cursor.secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Cursor secret must not be blank");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String encode(SearchCursor cursor) {
        ByteBuffer buffer = ByteBuffer.allocate(TOKEN_LENGTH);
        buffer.put(VERSION);
        buffer.putLong(cursor.getScore().unscaledValue().longValueExact());
        buffer.putLong(cursor.getId().getMostSignificantBits());
        buffer.putLong(cursor.getId().getLeastSignificantBits());
        buffer.putLong(cursor.getFilterFingerprint());
        buffer.put(tag(buffer.array(), PAYLOAD_LENGTH));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
    }

    /**
     * Decode and verify a client-supplied cursor.
     *
     * @throws InvalidCursorException if the token is not base64url, has the wrong
     *                                length or version, or its signature does not match
     */
    public SearchCursor decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCursorException("Cursor must not be empty");
        }
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("Cursor must be a valid base64url-encoded string");
        }
        if (bytes.length != TOKEN_LENGTH) {
            throw new InvalidCursorException("Cursor has an unexpected length");
        }
        if (bytes[0] != VERSION) {
            throw new InvalidCursorException("Cursor version is not supported");
        }
        byte[] expected = tag(bytes, PAYLOAD_LENGTH);
        byte[] actual = Arrays.copyOfRange(bytes, PAYLOAD_LENGTH, TOKEN_LENGTH);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new InvalidCursorException("Cursor signature does not match");
        }

        ByteBuffer buffer = ByteBuffer.wrap(bytes, 1, PAYLOAD_LENGTH - 1);
        BigDecimal score = BigDecimal.valueOf(buffer.getLong(), SearchCursor.SCORE_SCALE);
        UUID id = new UUID(buffer.getLong(), buffer.getLong());
        long fingerprint = buffer.getLong();
        return new SearchCursor(score, id, fingerprint);
    }

    /**
     * First 8 bytes of the SHA-256 of a search's canonical form.
     */
    public long fingerprint(String canonicalForm) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonicalForm.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private byte[] tag(byte[] data, int length) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            mac.update(data, 0, length);
            return Arrays.copyOf(mac.doFinal(), TAG_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign cursor", e);
        }
    }

    /**
     * Raised when a cursor cannot be decoded or fails verification.
     */
    public static class InvalidCursorException extends RuntimeException {
        public InvalidCursorException(String message) {
            super(message);
        }
    }
}
