package com.codecrucible.core.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable cache keys for (model, input, action, language).
 *
 * The input is normalized first (CRLF to LF, surrounding whitespace trimmed),
 * so the same prompt pasted from different editors maps to one key.
 */
public final class CacheKeys {

    private static final String PREFIX    = "crucible:";
    private static final char   SEPARATOR = '\u0000';

    private CacheKeys() {
    }

    public static String of(String modelId, String input, String action, String language) {
        StringBuilder material = new StringBuilder();
        material.append(nullToEmpty(modelId)).append(SEPARATOR)
                .append(normalize(input)).append(SEPARATOR)
                .append(nullToEmpty(action)).append(SEPARATOR)
                .append(nullToEmpty(language));
        return PREFIX + sha256(material.toString());
    }

    static String normalize(String input) {
        if (input == null) return "";
        return input.replace("\r\n", "\n").replace('\r', '\n').trim();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
