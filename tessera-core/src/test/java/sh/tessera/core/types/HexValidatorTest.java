// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

class HexValidatorTest {

    @Test
    void matchesExactLengthOnly() {
        Pattern fourBytes = HexValidator.fixedLength(4);
        assertTrue(fourBytes.matcher("0x01ffc9a7").matches());
        assertTrue(fourBytes.matcher("0x01FFC9A7").matches());
        assertFalse(fourBytes.matcher("0x01ffc9").matches());
        assertFalse(fourBytes.matcher("01ffc9a7").matches());
        assertFalse(fourBytes.matcher("0x01ffc9zz").matches());
    }

    @Test
    void normalizeLowercasesValidInput() {
        Pattern twoBytes = HexValidator.fixedLength(2);
        assertEquals("0xabcd", HexValidator.normalize("0xABcd", twoBytes, "pair"));
        assertSame(twoBytes, HexValidator.fixedLength(2));
    }

    @Test
    void normalizeNamesTheValueOnFailure() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> HexValidator.normalize("0x12", HexValidator.fixedLength(2), "pair"));
        assertEquals("Invalid pair: 0x12", ex.getMessage());
        assertThrows(NullPointerException.class, () -> HexValidator.normalize(null, HexValidator.fixedLength(2), "pair"));
        assertThrows(IllegalArgumentException.class, () -> HexValidator.fixedLength(0));
    }
}
