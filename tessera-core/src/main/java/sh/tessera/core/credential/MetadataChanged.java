// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.tessera.core.types.Address;

/**
 * A metadata value was written.
 *
 * @param source    the instance that stored the value
 * @param subjectId the subject the value belongs to, or {@code null} for
 *                  instance-level metadata
 * @param key       the metadata key
 * @param value     the new value (possibly empty)
 */
public record MetadataChanged(Address source, @Nullable SubjectId subjectId, String key, byte[] value)
        implements CredentialEvent {

    public MetadataChanged {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    /** Returns whether this change targets instance-level metadata. */
    public boolean isInstanceLevel() {
        return subjectId == null;
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MetadataChanged other)) return false;
        return source.equals(other.source)
            && Objects.equals(subjectId, other.subjectId)
            && key.equals(other.key)
            && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, subjectId, key, Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "MetadataChanged[source=" + source + ", subjectId=" + subjectId
            + ", key=" + key + ", value=(" + value.length + " bytes)]";
    }
}
