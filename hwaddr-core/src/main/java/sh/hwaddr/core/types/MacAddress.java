// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.jspecify.annotations.Nullable;

import sh.hwaddr.core.error.InvalidMacAddressException;
import sh.hwaddr.primitives.Bits;
import sh.hwaddr.primitives.Hex;

/**
 * 48-bit IEEE extended identifier (MAC address).
 * <p>
 * Accepts 12 hex digits ({@code 0-9}, {@code A-F}, or {@code a-f}) in plain,
 * hyphen, colon, or dot notation and stores them as 12 lowercase digits without
 * separators. Once constructed, every conversion and classification is total.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must match one {@link Notation} in full</li>
 * <li>No leading, trailing, missing, or mixed separators</li>
 * </ul>
 * <p>
 * Classification reads the first octet of {@link #toBinaryRepresentation()}, most
 * significant bit first, so index 7 is the I/G bit and index 6 is the U/L bit.
 *
 * <pre>{@code
 * MacAddress mac = new MacAddress("A0-B1-C2-D3-E4-F5");
 * mac.toPlainNotation();  // "a0b1c2d3e4f5"
 * mac.toDotNotation();    // "a0b1.c2d3.e4f5"
 * mac.kind();             // Kind.UNIQUE
 * mac.isUaa();            // true
 * }</pre>
 *
 * @since 0.1.0
 */
public record MacAddress(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 6;
    private static final String BROADCAST_DIGITS = "ffffffffffff";

    /** Index of the individual/group bit in the binary representation. */
    private static final int IG_BIT = 7;

    /** Index of the universal/local bit in the binary representation. */
    private static final int UL_BIT = 6;

    /** The broadcast address ({@code ff:ff:ff:ff:ff:ff}). */
    public static final MacAddress BROADCAST = new MacAddress(BROADCAST_DIGITS);

    /**
     * @throws InvalidMacAddressException if {@code value} matches none of the notations
     */
    public MacAddress {
        value = MacAddressNormalizer.normalize(value);
    }

    /**
     * Parses {@code text} in any accepted notation. Equivalent to the constructor.
     *
     * @throws InvalidMacAddressException if {@code text} matches none of the notations
     */
    @JsonCreator
    public static MacAddress parse(final String text) {
        return new MacAddress(text);
    }

    /**
     * Parses {@code text}, returning empty instead of throwing when it is not an address.
     */
    public static Optional<MacAddress> tryParse(final @Nullable String text) {
        return isValid(text) ? Optional.of(new MacAddress(text)) : Optional.empty();
    }

    public static boolean isValid(final @Nullable String text) {
        return MacAddressNormalizer.isValid(text);
    }

    public static MacAddress fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("MAC address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new MacAddress(Hex.encode(bytes));
    }

    /**
     * Inverse of {@link #toDecimalRepresentation()}.
     *
     * @throws IllegalArgumentException if {@code decimal} is negative or wider than 48 bits
     */
    public static MacAddress fromDecimal(final long decimal) {
        return fromBytes(Bits.fromUnsignedLong(decimal, BYTE_LENGTH));
    }

    /**
     * Decodes this address to a 6-byte array.
     *
     * <p><b>Allocation:</b> 1 allocation per call (result byte[]).
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Returns the binary representation, 48 digits, with the most-significant
     * bit of each octet first.
     */
    public String toBinaryRepresentation() {
        return Bits.toBinaryString(toBytes());
    }

    public long toDecimalRepresentation() {
        return Long.parseLong(toBinaryRepresentation(), 2);
    }

    /** Plain notation, for example {@code a0b1c2d3e4f5}. */
    public String toPlainNotation() {
        return value;
    }

    /** Hyphen notation, for example {@code a0-b1-c2-d3-e4-f5}. */
    public String toHyphenNotation() {
        return Notation.HYPHEN.format(value);
    }

    /** Colon notation, for example {@code a0:b1:c2:d3:e4:f5}. */
    public String toColonNotation() {
        return Notation.COLON.format(value);
    }

    /** Dot notation, for example {@code a0b1.c2d3.e4f5}. */
    public String toDotNotation() {
        return Notation.DOT.format(value);
    }

    public String format(final Notation notation) {
        return notation.format(value);
    }

    /**
     * Splits the plain notation into the OUI/CID half and the interface half,
     * for example {@code (a0b1c2, d3e4f5)}.
     */
    public Fragments toFragments() {
        return Fragments.of(value);
    }

    /**
     * Returns the identifier kind.
     * <p>
     * The two least-significant bits of the first octet decide whether it is an EUI
     * ({@code 00} = {@link Kind#UNIQUE}). Failing that, the four least-significant
     * bits decide whether it is an ELI ({@code 1010} = {@link Kind#LOCAL}).
     * Anything else is {@link Kind#UNKNOWN}.
     */
    public Kind kind() {
        final String binary = toBinaryRepresentation();
        if (binary.startsWith("00", 6)) {
            return Kind.UNIQUE;
        }
        if (binary.startsWith("1010", 4)) {
            return Kind.LOCAL;
        }
        return Kind.UNKNOWN;
    }

    /** An EUI has an OUI. */
    public boolean hasOui() {
        return kind() == Kind.UNIQUE;
    }

    /** An ELI has a CID. */
    public boolean hasCid() {
        return kind() == Kind.LOCAL;
    }

    public boolean isBroadcast() {
        return BROADCAST_DIGITS.equals(value);
    }

    /**
     * Whether this is a layer-two multicast address ({@code 1} in the I/G bit).
     */
    public boolean isMulticast() {
        return bitAt(IG_BIT) == '1';
    }

    public boolean isUnicast() {
        return !isMulticast();
    }

    /**
     * Whether this is a unicast, universally-administered address ({@code 0} in the U/L bit).
     */
    public boolean isUaa() {
        return isUnicast() && bitAt(UL_BIT) == '0';
    }

    /**
     * Whether this is a unicast, locally-administered address ({@code 1} in the U/L bit).
     */
    public boolean isLaa() {
        return isUnicast() && bitAt(UL_BIT) == '1';
    }

    @Override
    public String toString() {
        return toColonNotation();
    }

    private char bitAt(final int index) {
        return toBinaryRepresentation().charAt(index);
    }
}
