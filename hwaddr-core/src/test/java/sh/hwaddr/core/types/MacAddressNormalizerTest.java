// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.hwaddr.core.error.InvalidMacAddressException;

class MacAddressNormalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "0a1b2c3d4e5f",
        "0A1B2C3D4E5F",
        "0a-1b-2c-3d-4e-5f",
        "0A:1b:2C:3d:4E:5f",
        "0a1b.2c3d.4e5f"
    })
    void stripsSeparatorsAndLowercases(String text) {
        assertEquals("0a1b2c3d4e5f", MacAddressNormalizer.normalize(text));
        assertTrue(MacAddressNormalizer.isValid(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "0a",                  // too few digits
        "0a1b2c3d4e5f6",       // too many digits
        "0a1b2c3d4e5g",        // invalid digit
        "-0a-1b-2c-3d-4e-5f",  // leading hyphen
        "0a-1b-2c-3d-4e-5f-",  // trailing hyphen
        "0a-1b-2c-3d-4e5f",    // missing hyphen
        ":0a:1b:2c:3d:4e:5f",  // leading colon
        "0a:1b:2c:3d:4e:5f:",  // trailing colon
        "0a:1b:2c:3d:4e5f",    // missing colon
        ".0a1b.2c3d.4e5f",     // leading dot
        "0a1b.2c3d.4e5f.",     // trailing dot
        "0a1b.2c3d4e5f",       // missing dot
        "0a-1b-2c:3d:4e:5f",   // mixed separators
        " 0a1b2c3d4e5f",       // leading whitespace
        "0a1b2c3d4e5f ",       // trailing whitespace
        "0a 1b 2c 3d 4e 5f",   // space separators
        ""
    })
    void rejectsMalformedText(String text) {
        assertThrows(InvalidMacAddressException.class, () -> MacAddressNormalizer.normalize(text));
        assertFalse(MacAddressNormalizer.isValid(text));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> MacAddressNormalizer.normalize(null));
        assertFalse(MacAddressNormalizer.isValid(null));
    }

    @Test
    void alwaysYieldsTwelveDigits() {
        for (Notation notation : Notation.values()) {
            String normalized = MacAddressNormalizer.normalize(notation.format("ffffffffffff"));
            assertEquals(12, normalized.length());
        }
    }
}
