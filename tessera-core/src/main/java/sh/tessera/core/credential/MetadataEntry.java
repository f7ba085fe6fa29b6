// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One key and value in a batch metadata write.
 *
 * <p>Keys are arbitrary strings; values are arbitrary bytes, and an empty value
 * reads back exactly like a key that was never written.
 *
 * @param key   the metadata key
 * @param value the metadata value
 */
public record MetadataEntry(String key, byte[] value) {

    public MetadataEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    /** Entry whose value is the UTF-8 encoding of {@code text}. */
    public static MetadataEntry ofUtf8(String key, String text) {
        Objects.requireNonNull(text, "text");
        return new MetadataEntry(key, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    public String valueAsUtf8() {
        return new String(value, StandardCharsets.UTF_8);
    }

    /** Whether writing this entry clears the key. */
    public boolean clears() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MetadataEntry other)) return false;
        return key.equals(other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return key + "=(" + value.length + " bytes)";
    }
}
