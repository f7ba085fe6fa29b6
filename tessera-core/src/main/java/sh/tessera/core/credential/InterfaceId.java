// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import java.util.Objects;
import java.util.regex.Pattern;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.HexValidator;
import sh.tessera.primitives.Hex;

/**
 * 4-byte structural interface identifier, computed the ERC-165 way.
 *
 * <p>The identifier of an interface is the XOR of the selectors of all its
 * operation signatures, so two parties that agree on the signatures agree on
 * the identifier without sharing any code.
 *
 * <pre>{@code
 * InterfaceId reviews = InterfaceId.ofSignatures(
 *     "submitReview(uint256,uint256,bytes)",
 *     "getReview(uint256,uint256)");
 * }</pre>
 *
 * @param value {@code 0x}-prefixed 8-character hex string
 */
public record InterfaceId(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 4;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /** The reserved identifier no interface may claim ({@code 0xffffffff}). */
    public static final InterfaceId INVALID = new InterfaceId("0xffffffff");

    public InterfaceId {
        value = HexValidator.normalize(value, HEX, "interface id");
    }

    /**
     * Computes the identifier of an interface from its operation signatures.
     *
     * @param signatures canonical signatures, e.g. {@code "getReview(uint256,uint256)"}
     * @return the XOR of all selectors
     * @throws IllegalArgumentException if no signature is given
     */
    public static InterfaceId ofSignatures(String... signatures) {
        Objects.requireNonNull(signatures, "signatures");
        if (signatures.length == 0) {
            throw new IllegalArgumentException("at least one signature is required");
        }
        byte[] acc = new byte[BYTE_LENGTH];
        for (String signature : signatures) {
            byte[] selector = Keccak256.selector(signature);
            for (int i = 0; i < BYTE_LENGTH; i++) {
                acc[i] ^= selector[i];
            }
        }
        return fromBytes(acc);
    }

    public static InterfaceId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Interface id must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new InterfaceId(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decodeExact(value, BYTE_LENGTH);
    }

    @Override
    public String toString() {
        return value;
    }
}
