// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.primitives;

/**
 * Bit-level views over octet arrays.
 * <p>
 * All conversions are big-endian at the byte level and most-significant-bit
 * first within each octet, which is the order IEEE 802 uses when it talks
 * about "the first bit" of an address in text.
 *
 * @since 0.1.0
 */
public final class Bits {
    private static final int OCTET_BITS = 8;
    private static final int MAX_LONG_BYTES = Long.BYTES;

    private Bits() {
        // Utility class
    }

    /**
     * Renders a single octet as an 8-character, zero-padded binary string.
     *
     * @param octet the octet value (0-255)
     * @return binary digits, most-significant bit first
     * @throws IllegalArgumentException if {@code octet} is outside 0-255
     */
    public static String toBinaryString(final int octet) {
        if (octet < 0 || octet > 0xFF) {
            throw new IllegalArgumentException("octet must be in range 0-255: " + octet);
        }
        final char[] chars = new char[OCTET_BITS];
        appendOctet(octet, chars, 0);
        return new String(chars);
    }

    /**
     * Renders every octet as 8 binary digits and concatenates them in array order.
     *
     * @param bytes the octets to render
     * @return a string of {@code bytes.length * 8} binary digits
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String toBinaryString(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * OCTET_BITS];
        for (int i = 0; i < bytes.length; i++) {
            appendOctet(bytes[i] & 0xFF, chars, i * OCTET_BITS);
        }
        return new String(chars);
    }

    /**
     * Reads up to eight bytes as a big-endian unsigned value.
     *
     * @param bytes the octets, most significant first
     * @return the unsigned value
     * @throws IllegalArgumentException if {@code bytes} is {@code null} or longer than 8 bytes
     */
    public static long toUnsignedLong(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (bytes.length > MAX_LONG_BYTES) {
            throw new IllegalArgumentException("at most " + MAX_LONG_BYTES + " bytes fit in a long: " + bytes.length);
        }
        long value = 0;
        for (byte b : bytes) {
            value = (value << OCTET_BITS) | (b & 0xFF);
        }
        return value;
    }

    /**
     * Writes {@code value} into a big-endian array of {@code length} bytes.
     *
     * @param value  a non-negative value
     * @param length the number of bytes to produce (1-7)
     * @return the big-endian octets
     * @throws IllegalArgumentException if {@code length} is out of range or
     *                                  {@code value} does not fit in {@code length} bytes
     */
    public static byte[] fromUnsignedLong(final long value, final int length) {
        if (length < 1 || length >= MAX_LONG_BYTES) {
            throw new IllegalArgumentException("length must be in range 1-7: " + length);
        }
        if (value < 0 || (value >>> (length * OCTET_BITS)) != 0) {
            throw new IllegalArgumentException("value " + value + " does not fit in " + length + " bytes");
        }
        final byte[] out = new byte[length];
        long remaining = value;
        for (int i = length - 1; i >= 0; i--) {
            out[i] = (byte) remaining;
            remaining >>>= OCTET_BITS;
        }
        return out;
    }

    private static void appendOctet(final int octet, final char[] dest, final int offset) {
        for (int bit = 0; bit < OCTET_BITS; bit++) {
            dest[offset + bit] = ((octet >>> (OCTET_BITS - 1 - bit)) & 1) == 1 ? '1' : '0';
        }
    }
}
