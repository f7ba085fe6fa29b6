// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.tessera.core.types.Address;

class CredentialEventTest {

    private static final Address SOURCE = new Address("0x" + "a".repeat(40));

    @Test
    void metadataChangedDistinguishesInstanceLevel() {
        assertTrue(new MetadataChanged(SOURCE, null, "name", new byte[0]).isInstanceLevel());
        assertFalse(new MetadataChanged(SOURCE, SubjectId.of(1), "k", new byte[0]).isInstanceLevel());
    }

    @Test
    void metadataChangedComparesValueContents() {
        MetadataChanged a = new MetadataChanged(SOURCE, SubjectId.of(1), "k", new byte[] {1});
        MetadataChanged b = new MetadataChanged(SOURCE, SubjectId.of(1), "k", new byte[] {1});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void everyEventExposesSource() {
        CredentialEvent event = new OwnershipTransferred(SOURCE, Address.ZERO, SOURCE);
        assertEquals(SOURCE, event.source());
    }

    @Test
    void defaultRegistryIsNonZero() {
        assertFalse(TesseraAddresses.DEFAULT_REGISTRY.isZero());
    }
}
