// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import java.util.Arrays;
import java.util.Objects;

import sh.tessera.core.types.Hash;

/**
 * Change notification for one slot write.
 *
 * @param namespace the namespace written to
 * @param slot      the physical slot
 * @param key       the full encoded composite key
 * @param value     the value written
 */
public record SlotWrite(Namespace namespace, Hash slot, byte[] key, byte[] value) {

    public SlotWrite {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        key = key.clone();
        value = value.clone();
    }

    @Override
    public byte[] key() {
        return key.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SlotWrite other)) return false;
        return namespace.equals(other.namespace)
            && slot.equals(other.slot)
            && Arrays.equals(key, other.key)
            && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, slot, Arrays.hashCode(key), Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "SlotWrite[namespace=" + namespace.domain() + ", slot=" + slot
            + ", key=(" + key.length + " bytes), value=(" + value.length + " bytes)]";
    }
}
