// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.regex.Pattern;

import sh.tessera.primitives.Hex;

/**
 * Hex-encoded 32-byte value (Keccak-256 digest or salt).
 * <p>
 * Used for namespace identifiers, storage slots, code hashes and
 * deterministic-deployment salts.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    /** Number of bytes in a hash. */
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Hash {
        value = HexValidator.normalize(value, HEX, "hash");
    }

    public byte[] toBytes() {
        return Hex.decodeExact(value, BYTE_LENGTH);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
