// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shortens credential payloads in debug log lines.
 *
 * <p>
 * Performs two operations:
 * <ul>
 * <li>Elides long hex blobs (metadata values, review data) to their first
 * bytes and length, so stored credential contents never land in logs whole</li>
 * <li>Truncates excessively long lines</li>
 * </ul>
 * Addresses (40 hex chars) and hashes (64 hex chars) are left intact.
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Hex values longer than a hash are treated as payload blobs. */
    private static final Pattern BLOB_PATTERN = Pattern.compile("0x([0-9a-fA-F]{65,})");

    /** Hex characters kept at the start of an elided blob. */
    private static final int BLOB_PREFIX_CHARS = 8;

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("0x")) {
            final Matcher matcher = BLOB_PATTERN.matcher(sanitized);
            final StringBuilder out = new StringBuilder();
            while (matcher.find()) {
                final String hex = matcher.group(1);
                final String replacement = "0x" + hex.substring(0, BLOB_PREFIX_CHARS)
                        + "...(" + (hex.length() / 2) + " bytes)";
                matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(out);
            sanitized = out.toString();
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
