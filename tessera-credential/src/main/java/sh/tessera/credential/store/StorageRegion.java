// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import sh.tessera.core.DebugLogger;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

/**
 * Private slot storage owned by exactly one credential instance.
 *
 * <p>Slots map to byte values. A slot that was never written reads as an
 * empty array. Reads may run concurrently with writes; writes are serialized
 * by the owning instance.
 */
public final class StorageRegion {

    private static final byte[] EMPTY = new byte[0];

    private final Address owner;
    private final Map<Hash, byte[]> slots = new ConcurrentHashMap<>();
    private final List<Consumer<SlotWrite>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param owner address of the instance this region belongs to
     */
    public StorageRegion(Address owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public Address owner() {
        return owner;
    }

    /**
     * Returns a copy of the value at {@code slot}, or an empty array.
     */
    public byte[] read(Hash slot) {
        Objects.requireNonNull(slot, "slot");
        byte[] value = slots.get(slot);
        return value == null ? EMPTY.clone() : value.clone();
    }

    /**
     * Stores {@code write.value()} at {@code write.slot()} and notifies listeners.
     */
    void write(SlotWrite write) {
        slots.put(write.slot(), write.value());
        DebugLogger.logStore("[STORE] region=%s ns=%s slot=%s value=%s",
                owner.value(), write.namespace().domain(), write.slot().value(), Hex.encode(write.value()));
        for (Consumer<SlotWrite> listener : listeners) {
            listener.accept(write);
        }
    }

    /**
     * Registers a listener invoked after every write to this region.
     *
     * @param listener the listener
     */
    public void addListener(Consumer<SlotWrite> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(Consumer<SlotWrite> listener) {
        listeners.remove(listener);
    }

    /** Number of slots ever written. */
    public int slotCount() {
        return slots.size();
    }
}
