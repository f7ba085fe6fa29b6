// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.regex.Pattern;

import sh.tessera.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Identifies callers, owners, registries, factories and credential instances.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    /** Number of bytes in an address. */
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * The null address: "no owner" after renouncement, and the placeholder a
     * caller passes to request the default registry.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        value = HexValidator.normalize(value, HEX, "address");
    }

    /**
     * Returns whether this is {@link #ZERO}.
     *
     * @return true for the null address
     */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return a new 20-byte array
     */
    public byte[] toBytes() {
        return Hex.decodeExact(value, BYTE_LENGTH);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
