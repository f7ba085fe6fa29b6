// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives;

import java.math.BigInteger;

/**
 * Fixed-width 32-byte word encoding for unsigned 256-bit integers.
 *
 * <p>Words are big-endian and left-padded with zeros, the layout used for
 * storage slot derivation and address computation.
 *
 * @since 0.1.0
 */
public final class Words {

    /** Width of one word in bytes. */
    public static final int WORD_SIZE = 32;

    /** Largest value a word can hold ({@code 2^256 - 1}). */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Words() {
        // Utility class
    }

    /**
     * Encodes an unsigned integer as a 32-byte big-endian word.
     *
     * @param value the value, in {@code [0, 2^256)}
     * @return a new 32-byte array
     * @throws IllegalArgumentException if value is null, negative or wider than 256 bits
     */
    public static byte[] uint256(final BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
            throw new IllegalArgumentException("value out of uint256 range: " + value);
        }
        final byte[] raw = value.toByteArray();
        final byte[] word = new byte[WORD_SIZE];
        // toByteArray may carry a leading sign byte; copy only the low 32 bytes
        final int copy = Math.min(raw.length, WORD_SIZE);
        System.arraycopy(raw, raw.length - copy, word, WORD_SIZE - copy, copy);
        return word;
    }

    /**
     * Concatenates byte arrays in order.
     *
     * @param parts the arrays to join
     * @return a new array holding every part
     * @throws IllegalArgumentException if any part is null
     */
    public static byte[] concat(final byte[]... parts) {
        int length = 0;
        for (final byte[] part : parts) {
            if (part == null) {
                throw new IllegalArgumentException("part cannot be null");
            }
            length += part.length;
        }
        final byte[] out = new byte[length];
        int pos = 0;
        for (final byte[] part : parts) {
            System.arraycopy(part, 0, out, pos, part.length);
            pos += part.length;
        }
        return out;
    }
}
