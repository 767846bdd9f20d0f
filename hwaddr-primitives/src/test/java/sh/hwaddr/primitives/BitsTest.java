// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BitsTest {

    @Nested
    class BinaryString {

        @Test
        void padsSingleOctetToEightDigits() {
            assertEquals("00000000", Bits.toBinaryString(0x00));
            assertEquals("00000001", Bits.toBinaryString(0x01));
            assertEquals("00001010", Bits.toBinaryString(0x0A));
            assertEquals("10100000", Bits.toBinaryString(0xA0));
            assertEquals("11111111", Bits.toBinaryString(0xFF));
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 256, Integer.MAX_VALUE})
        void rejectsOutOfRangeOctet(int octet) {
            assertThrows(IllegalArgumentException.class, () -> Bits.toBinaryString(octet));
        }

        @Test
        void concatenatesOctetsInArrayOrder() {
            byte[] bytes = {(byte) 0xA0, (byte) 0xB1, (byte) 0xC2, (byte) 0xD3, (byte) 0xE4, (byte) 0xF5};
            assertEquals("101000001011000111000010110100111110010011110101", Bits.toBinaryString(bytes));
        }

        @Test
        void emptyArrayRendersEmptyString() {
            assertEquals("", Bits.toBinaryString(new byte[0]));
        }

        @Test
        void agreesWithIntegerToBinaryString() {
            for (int octet = 0; octet <= 0xFF; octet++) {
                String expected = String.format("%8s", Integer.toBinaryString(octet)).replace(' ', '0');
                assertEquals(expected, Bits.toBinaryString(octet));
            }
        }

        @Test
        void rejectsNullArray() {
            assertThrows(IllegalArgumentException.class, () -> Bits.toBinaryString((byte[]) null));
        }
    }

    @Nested
    class UnsignedLong {

        @Test
        void readsBigEndian() {
            byte[] bytes = {(byte) 0xA0, (byte) 0xB1, (byte) 0xC2, (byte) 0xD3, (byte) 0xE4, (byte) 0xF5};
            assertEquals(176685338322165L, Bits.toUnsignedLong(bytes));
            assertEquals(0L, Bits.toUnsignedLong(new byte[0]));
        }

        @Test
        void treatsHighBitAsUnsigned() {
            byte[] bytes = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
            assertEquals(281474976710655L, Bits.toUnsignedLong(bytes));
        }

        @Test
        void rejectsMoreThanEightBytes() {
            assertThrows(IllegalArgumentException.class, () -> Bits.toUnsignedLong(new byte[9]));
            assertThrows(IllegalArgumentException.class, () -> Bits.toUnsignedLong(null));
        }

        @Test
        void writesBigEndian() {
            byte[] expected = {0x01, (byte) 0x80, (byte) 0xC2, 0x00, 0x00, 0x00};
            assertArrayEquals(expected, Bits.fromUnsignedLong(1652522221568L, 6));
        }

        @Test
        void rejectsValuesThatDoNotFit() {
            assertThrows(IllegalArgumentException.class, () -> Bits.fromUnsignedLong(1L << 48, 6));
            assertThrows(IllegalArgumentException.class, () -> Bits.fromUnsignedLong(-1L, 6));
            assertThrows(IllegalArgumentException.class, () -> Bits.fromUnsignedLong(1L, 0));
            assertThrows(IllegalArgumentException.class, () -> Bits.fromUnsignedLong(1L, 8));
        }

        @Test
        void roundTripsThroughBytes() {
            long value = 11111822610015L;
            assertEquals(value, Bits.toUnsignedLong(Bits.fromUnsignedLong(value, 6)));
        }
    }
}
