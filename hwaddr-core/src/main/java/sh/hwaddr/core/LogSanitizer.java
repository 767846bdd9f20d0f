// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core;

/**
 * Utility that makes caller-supplied text safe to put in a log line.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Replaces control characters (CR, LF, TAB, ...) with {@code ?} so input cannot forge log lines</li>
 * <li>Truncates excessively long values</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized output, suffix included. */
    private static final int MAX_LOG_LENGTH = 256;

    /** Suffix appended to truncated values. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final char REPLACEMENT = '?';

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        StringBuilder out = null;
        for (int i = 0; i < sanitized.length(); i++) {
            if (Character.isISOControl(sanitized.charAt(i))) {
                if (out == null) {
                    out = new StringBuilder(sanitized);
                }
                out.setCharAt(i, REPLACEMENT);
            }
        }

        return out == null ? sanitized : out.toString();
    }
}
