// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class MetadataEntryTest {

    @Test
    void copiesValueOnConstruction() {
        byte[] value = "v1".getBytes(StandardCharsets.UTF_8);
        MetadataEntry entry = new MetadataEntry("k", value);
        value[0] = 'X';
        assertArrayEquals("v1".getBytes(StandardCharsets.UTF_8), entry.value());
    }

    @Test
    void copiesValueOnAccess() {
        MetadataEntry entry = new MetadataEntry("k", new byte[] {1, 2});
        entry.value()[0] = 9;
        assertArrayEquals(new byte[] {1, 2}, entry.value());
    }

    @Test
    void equalityComparesContents() {
        MetadataEntry a = new MetadataEntry("k", new byte[] {1, 2});
        MetadataEntry b = new MetadataEntry("k", new byte[] {1, 2});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new MetadataEntry("k", new byte[] {1}));
    }

    @Test
    void emptyValueClearsKey() {
        assertTrue(new MetadataEntry("k", new byte[0]).clears());
        assertFalse(MetadataEntry.ofUtf8("k", "v").clears());
    }

    @Test
    void utf8Helpers() {
        MetadataEntry entry = MetadataEntry.ofUtf8("k", "héllo");
        assertEquals(new MetadataEntry("k", "héllo".getBytes(StandardCharsets.UTF_8)), entry);
        assertEquals("héllo", entry.valueAsUtf8());
    }

    @Test
    void toStringHidesBytes() {
        assertEquals("k=(3 bytes)", new MetadataEntry("k", new byte[3]).toString());
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> new MetadataEntry(null, new byte[0]));
        assertThrows(NullPointerException.class, () -> new MetadataEntry("k", null));
    }
}
