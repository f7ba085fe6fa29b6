// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class SubjectIdTest {

    @Test
    void of_createsFromLong() {
        assertEquals(BigInteger.valueOf(42), SubjectId.of(42).value());
    }

    @Test
    void acceptsZeroAndMaxUint256() {
        assertEquals(BigInteger.ZERO, SubjectId.of(0).value());
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
        assertEquals(max, new SubjectId(max).value());
    }

    @Test
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> SubjectId.of(-1));
    }

    @Test
    void rejectsOverflow() {
        assertThrows(IllegalArgumentException.class, () -> new SubjectId(BigInteger.TWO.pow(256)));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> new SubjectId(null));
    }

    @Test
    void toWord_isBigEndianUint256() {
        byte[] word = SubjectId.of(258).toWord();
        assertEquals(32, word.length);
        assertEquals(1, word[30]);
        assertEquals(2, word[31]);
        assertEquals(0, word[0]);
    }

    @Test
    void equalityByValue() {
        assertEquals(SubjectId.of(7), new SubjectId(BigInteger.valueOf(7)));
        assertEquals("SubjectId(7)", SubjectId.of(7).toString());
    }
}
