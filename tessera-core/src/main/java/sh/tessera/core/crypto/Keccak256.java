// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import sh.tessera.core.types.Hash;

/**
 * Keccak-256 hashing utility.
 *
 * <p>
 * Keccak-256 (not SHA3-256) derives namespace identifiers, storage slots,
 * interface selectors and deterministic instance addresses. Backed by
 * BouncyCastle's {@code Keccak.Digest256}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Hash id = Keccak256.hashUtf8("tessera.credential.reviews.v1");
 * byte[] slot = Keccak256.hash(id.toBytes(), encodedKey);
 * }</pre>
 *
 * <p>
 * Digest instances are cached per thread. Call {@link #cleanup()} when a
 * pooled thread is returned after use in a container.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 hash of multiple input arrays concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Hashes the UTF-8 encoding of {@code text}.
     *
     * @param text the string to hash
     * @return the digest as a {@link Hash}
     * @throws NullPointerException if text is null
     */
    public static Hash hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return Hash.fromBytes(hash(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Computes the 4-byte selector of an operation signature, such as
     * {@code "getReview(uint256,uint256)"}.
     *
     * @param signature the canonical signature
     * @return the first 4 bytes of its Keccak-256 hash
     * @throws NullPointerException if signature is null
     */
    public static byte[] selector(final String signature) {
        Objects.requireNonNull(signature, "signature cannot be null");
        return Arrays.copyOf(hash(signature.getBytes(StandardCharsets.UTF_8)), 4);
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
