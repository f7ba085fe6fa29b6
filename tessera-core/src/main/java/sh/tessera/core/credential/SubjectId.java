// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import java.math.BigInteger;
import java.util.Objects;

import sh.tessera.primitives.Words;

/**
 * Identifier of a subject known to a subject registry.
 *
 * <p>Wraps an unsigned 256-bit integer, the token id under which the registry
 * tracks the subject's owner.
 *
 * @param value the id, in {@code [0, 2^256)}
 * @throws NullPointerException     if value is null
 * @throws IllegalArgumentException if value is negative or wider than 256 bits
 */
public record SubjectId(BigInteger value) {

    public SubjectId {
        Objects.requireNonNull(value, "subjectId");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("subjectId must be non-negative");
        }
        if (value.compareTo(Words.MAX_UINT256) > 0) {
            throw new IllegalArgumentException("subjectId exceeds uint256");
        }
    }

    /**
     * Creates a SubjectId from a long value.
     *
     * @param id the subject id
     * @return the subject identifier
     * @throws IllegalArgumentException if id is negative
     */
    public static SubjectId of(long id) {
        return new SubjectId(BigInteger.valueOf(id));
    }

    /**
     * Encodes the id as a 32-byte big-endian word.
     *
     * @return a new 32-byte array
     */
    public byte[] toWord() {
        return Words.uint256(value);
    }

    @Override
    public String toString() {
        return "SubjectId(" + value + ")";
    }
}
