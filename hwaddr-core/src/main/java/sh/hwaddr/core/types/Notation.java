// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The four textual notations a MAC address may be written in.
 * <p>
 * <table border="1">
 * <tr><th>Notation</th><th>Example</th></tr>
 * <tr><td>{@link #PLAIN}</td><td>{@code a0b1c2d3e4f5}</td></tr>
 * <tr><td>{@link #HYPHEN}</td><td>{@code a0-b1-c2-d3-e4-f5}</td></tr>
 * <tr><td>{@link #COLON}</td><td>{@code a0:b1:c2:d3:e4:f5}</td></tr>
 * <tr><td>{@link #DOT}</td><td>{@code a0b1.c2d3.e4f5}</td></tr>
 * </table>
 * <p>
 * Each constant owns a whole-string pattern compiled once when the enum is
 * initialized. Hex digits match in either case.
 *
 * @since 0.1.0
 */
public enum Notation {
    PLAIN("^[0-9A-Fa-f]{12}$", "", 12),
    HYPHEN("^([0-9A-Fa-f]{2}-){5}[0-9A-Fa-f]{2}$", "-", 2),
    COLON("^([0-9A-Fa-f]{2}:){5}[0-9A-Fa-f]{2}$", ":", 2),
    DOT("^([0-9A-Fa-f]{4}\\.){2}[0-9A-Fa-f]{4}$", ".", 4);

    /** Number of hex digits in a 48-bit address. */
    public static final int DIGITS = 12;

    private final Pattern pattern;
    private final String separator;
    private final int groupWidth;

    Notation(final String regex, final String separator, final int groupWidth) {
        this.pattern = Pattern.compile(regex);
        this.separator = separator;
        this.groupWidth = groupWidth;
    }

    /**
     * Returns whether the whole of {@code text} is written in this notation.
     */
    public boolean matches(final CharSequence text) {
        return text != null && pattern.matcher(text).matches();
    }

    /**
     * Groups 12 normalized digits and joins the groups with this notation's separator.
     *
     * @param digits exactly 12 hex digits, no separators
     * @return the digits in this notation, in their original order
     * @throws IllegalArgumentException if {@code digits} is not 12 characters long
     */
    public String format(final String digits) {
        Objects.requireNonNull(digits, "digits");
        if (digits.length() != DIGITS) {
            throw new IllegalArgumentException("Expected " + DIGITS + " digits: " + digits);
        }
        if (separator.isEmpty()) {
            return digits;
        }
        final StringBuilder sb = new StringBuilder(DIGITS + DIGITS / groupWidth - 1);
        for (int i = 0; i < DIGITS; i += groupWidth) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(digits, i, i + groupWidth);
        }
        return sb.toString();
    }

    public String separator() {
        return separator;
    }

    public int groupWidth() {
        return groupWidth;
    }

    /**
     * Finds the notation {@code text} is written in.
     *
     * @param text candidate address text
     * @return the matching notation, or empty if none matches (or {@code text} is null)
     */
    public static Optional<Notation> detect(final CharSequence text) {
        for (Notation notation : values()) {
            if (notation.matches(text)) {
                return Optional.of(notation);
            }
        }
        return Optional.empty();
    }
}
