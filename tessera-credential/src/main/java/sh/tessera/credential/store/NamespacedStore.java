// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import java.util.Objects;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Hash;

/**
 * Typed view of one {@link Namespace} inside any {@link StorageRegion}.
 *
 * <p>A store holds no data. It maps a key to the slot
 * {@code keccak256(namespaceId || codec.encode(key))} and reads or writes that
 * slot in whichever region it is handed, so a single store constant serves
 * every instance sharing the credential logic.
 *
 * <p>Semantics: last write wins, no history, no deletion. {@link #get} never
 * fails and returns an empty array for keys that were never written, which is
 * indistinguishable from an explicitly stored empty value.
 *
 * @param <K> the composite key type
 */
public final class NamespacedStore<K> {

    private final Namespace namespace;
    private final KeyCodec<K> codec;
    private final byte[] namespaceId;

    public NamespacedStore(Namespace namespace, KeyCodec<K> codec) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.namespaceId = namespace.id().toBytes();
    }

    public Namespace namespace() {
        return namespace;
    }

    /**
     * Computes the slot a key occupies in every region.
     *
     * @param key the composite key
     * @return the slot
     */
    public Hash slotOf(K key) {
        Objects.requireNonNull(key, "key");
        return Hash.fromBytes(Keccak256.hash(namespaceId, codec.encode(key)));
    }

    /**
     * Reads the value for {@code key} in {@code region}.
     *
     * @return a copy of the value, or an empty array if absent
     */
    public byte[] get(StorageRegion region, K key) {
        Objects.requireNonNull(region, "region");
        return region.read(slotOf(key));
    }

    /**
     * Overwrites the value for {@code key} in {@code region} and notifies the
     * region's listeners with the full encoded key and value.
     */
    public void set(StorageRegion region, K key, byte[] value) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        byte[] encoded = codec.encode(key);
        Hash slot = Hash.fromBytes(Keccak256.hash(namespaceId, encoded));
        region.write(new SlotWrite(namespace, slot, encoded, value));
    }
}
