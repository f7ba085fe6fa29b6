// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.store;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.tessera.core.crypto.Keccak256;

class NamespaceTest {

    @Test
    void idIsHashOfDomain() {
        Namespace ns = Namespace.of("example.registry.v1");
        assertEquals(Keccak256.hashUtf8("example.registry.v1"), ns.id());
    }

    @Test
    void rejectsMismatchedId() {
        assertThrows(IllegalArgumentException.class,
            () -> new Namespace("a", Keccak256.hashUtf8("b")));
    }

    @Test
    void rejectsBlankDomain() {
        assertThrows(IllegalArgumentException.class, () -> Namespace.of("  "));
    }
}
