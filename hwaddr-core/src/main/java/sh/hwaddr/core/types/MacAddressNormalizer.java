// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.hwaddr.core.DebugLogger;
import sh.hwaddr.core.error.InvalidMacAddressException;
import sh.hwaddr.primitives.Hex;

/**
 * Validates MAC address text and reduces it to 12 lowercase hex digits.
 * <p>
 * Text is accepted only if it matches one of the {@link Notation} patterns in
 * full. Separators are stripped after the match, so the result of
 * {@link #normalize(String)} is always exactly 12 digits.
 *
 * @since 0.1.0
 */
public final class MacAddressNormalizer {
    private MacAddressNormalizer() {}

    /**
     * Normalizes {@code text} written in plain, hyphen, colon, or dot notation.
     *
     * @param text the address text
     * @return 12 lowercase hex digits without separators
     * @throws NullPointerException        if {@code text} is null
     * @throws InvalidMacAddressException if {@code text} matches none of the notations
     */
    public static String normalize(final String text) {
        Objects.requireNonNull(text, "address");
        if (Notation.detect(text).isEmpty()) {
            DebugLogger.log("[REJECT] input=%s", text);
            throw new InvalidMacAddressException(text);
        }
        return strip(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether {@code text} would be accepted by {@link #normalize(String)}.
     */
    public static boolean isValid(final @Nullable String text) {
        return text != null && Notation.detect(text).isPresent();
    }

    private static String strip(final String lowercase) {
        final StringBuilder digits = new StringBuilder(Notation.DIGITS);
        for (int i = 0; i < lowercase.length(); i++) {
            final char c = lowercase.charAt(i);
            if (Hex.isHexDigit(c)) {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
