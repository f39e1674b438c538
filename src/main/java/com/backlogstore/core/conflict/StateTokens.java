package com.backlogstore.core.conflict;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * State tokens: SHA-256 over the exact bytes of a record. Any difference in
 * content, trailing blank lines and line endings included, gives a different
 * token.
 */
public final class StateTokens {

    private StateTokens() {
    }

    public static String compute(byte[] content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content);
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Token of text as it is stored on disk (UTF-8). */
    public static String compute(String content) {
        return compute(content.getBytes(StandardCharsets.UTF_8));
    }
}
