// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.primitives;

import java.util.Arrays;

/**
 * Utility methods for separator-free hex encoding/decoding.
 * <p>
 * Hardware addresses never carry a {@code 0x} prefix, so neither direction
 * accepts or emits one. Encoding is always lowercase; decoding accepts either case.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Returns whether {@code c} is a hex digit ({@code 0-9}, {@code a-f}, {@code A-F}).
     *
     * @param c the character to test
     * @return {@code true} if the character is a hex digit
     */
    public static boolean isHexDigit(final char c) {
        return c < NIBBLE_LOOKUP.length && NIBBLE_LOOKUP[c] != -1;
    }

    /**
     * Convert a separator-free hex string into a byte array.
     *
     * <p><b>Allocation:</b> 1 allocation (result byte[]).
     *
     * @param hex the characters to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final CharSequence hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int hexLength = hex.length();
        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }

        final byte[] result = new byte[hexLength / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hex.charAt(i * 2), hex);
            final int low = toNibble(hex.charAt(i * 2 + 1), hex);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Convert a byte array into a lowercase hex string without separators.
     *
     * <p><b>Allocation:</b> 2 allocations (char[] + String).
     *
     * @param bytes the bytes to encode
     * @return lowercase hex, two characters per byte
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    private static int toNibble(final char c, final CharSequence originalInput) {
        if (!isHexDigit(c)) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
