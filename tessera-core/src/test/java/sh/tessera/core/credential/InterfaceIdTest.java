// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import sh.tessera.core.crypto.Keccak256;

class InterfaceIdTest {

    @Test
    void singleSignatureIsItsSelector() {
        assertEquals(new InterfaceId("0x01ffc9a7"), InterfaceId.ofSignatures("supportsInterface(bytes4)"));
    }

    @Test
    void multipleSignaturesXorTogether() {
        byte[] a = Keccak256.selector("getReview(uint256,uint256)");
        byte[] b = Keccak256.selector("submitReview(uint256,uint256,bytes)");
        byte[] expected = new byte[4];
        for (int i = 0; i < 4; i++) {
            expected[i] = (byte) (a[i] ^ b[i]);
        }
        InterfaceId id = InterfaceId.ofSignatures("getReview(uint256,uint256)", "submitReview(uint256,uint256,bytes)");
        assertArrayEquals(expected, id.toBytes());
    }

    @Test
    void orderDoesNotMatter() {
        assertEquals(
            InterfaceId.ofSignatures("owner()", "renounceOwnership()"),
            InterfaceId.ofSignatures("renounceOwnership()", "owner()"));
    }

    @Test
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> new InterfaceId("0x01ffc9"));
        assertThrows(IllegalArgumentException.class, () -> InterfaceId.fromBytes(new byte[5]));
        assertThrows(IllegalArgumentException.class, () -> InterfaceId.ofSignatures());
    }

    @Test
    void normalizesCase() {
        assertEquals(InterfaceId.INVALID, new InterfaceId("0xFFFFFFFF"));
    }

    @Test
    void serializesAsHexString() throws Exception {
        assertEquals("\"0x01ffc9a7\"", new ObjectMapper().writeValueAsString(new InterfaceId("0x01ffc9a7")));
    }
}
