package com.agentic.customergraph.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Cleans error text before it is logged or persisted as an upload record's
 * {@code last_error}: control characters are flattened, credentials,
 * e-mail addresses and card-like numbers are redacted and the result is capped in length.
 */
public final class SensitiveDataSanitizer {

    static final int MAX_LENGTH = 500;
    static final String REDACTED = "[REDACTED]";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t\\x00-\\x1F]+");
    private static final Pattern BEARER_TOKEN = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
        "(?i)\\b(api[_-]?key|token|secret|password|passwd)\\s*[=:]\\s*[^\\s,;&]+");
    private static final Pattern CARD_NUMBER = Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    private SensitiveDataSanitizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String sanitize(@Nullable String text) {
        if (text == null) {
            return "null";
        }
        String sanitized = CONTROL_CHARS.matcher(text).replaceAll(" ");
        sanitized = BEARER_TOKEN.matcher(sanitized).replaceAll("Bearer " + REDACTED);
        sanitized = SECRET_ASSIGNMENT.matcher(sanitized).replaceAll("$1=" + REDACTED);
        sanitized = EMAIL.matcher(sanitized).replaceAll(REDACTED);
        sanitized = CARD_NUMBER.matcher(sanitized).replaceAll(REDACTED);
        if (sanitized.length() > MAX_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LENGTH) + "...";
        }
        return sanitized.trim();
    }
}
