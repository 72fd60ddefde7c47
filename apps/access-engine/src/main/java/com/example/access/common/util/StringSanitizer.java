package com.example.access.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_TAG_MAX_LENGTH = 50;
    private static final String TAG_UNKNOWN = "unknown";

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Bounded, lower-case metric tag value.
     */
    @NonNull
    public static String forTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > DEFAULT_TAG_MAX_LENGTH) {
            sanitized = sanitized.substring(0, DEFAULT_TAG_MAX_LENGTH);
        }
        return sanitized;
    }

    @NonNull
    public static String orEmpty(@Nullable String value) {
        return value != null ? value : "";
    }
}
