// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import java.nio.charset.StandardCharsets;

/**
 * Encodes a composite key into the bytes hashed into its storage slot.
 *
 * <p>Encodings must be injective within a namespace: two distinct keys must
 * never produce the same bytes. Fixed-width fields first and at most one
 * variable-width field, placed last, satisfies this.
 *
 * @param <K> the key type
 */
@FunctionalInterface
public interface KeyCodec<K> {

    byte[] encode(K key);

    /** UTF-8 encoding for plain string keys. */
    static KeyCodec<String> utf8() {
        return key -> key.getBytes(StandardCharsets.UTF_8);
    }
}
