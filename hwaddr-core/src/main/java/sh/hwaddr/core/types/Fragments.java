// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

import java.util.Objects;

/**
 * The two 24-bit halves of a MAC address in plain notation.
 *
 * @param first  first 6 hex digits, the OUI or CID
 * @param second last 6 hex digits, specific to the interface
 * @since 0.1.0
 */
public record Fragments(String first, String second) {
    private static final int FRAGMENT_DIGITS = Notation.DIGITS / 2;

    public Fragments {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.length() != FRAGMENT_DIGITS || second.length() != FRAGMENT_DIGITS) {
            throw new IllegalArgumentException(
                    "Fragments must be " + FRAGMENT_DIGITS + " digits each: " + first + ", " + second);
        }
    }

    static Fragments of(final String plain) {
        return new Fragments(plain.substring(0, FRAGMENT_DIGITS), plain.substring(FRAGMENT_DIGITS));
    }

    /**
     * Returns {@code first + second}, the plain notation the fragments came from.
     */
    public String joined() {
        return first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
