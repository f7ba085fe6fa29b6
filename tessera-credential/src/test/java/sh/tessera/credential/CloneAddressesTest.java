// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

class CloneAddressesTest {

    private static final Hash ZERO_SALT = new Hash("0x" + "0".repeat(64));

    private static Hash codeHash(String initCode) {
        return Hash.fromBytes(Keccak256.hash(Hex.decode(initCode)));
    }

    @Test
    void create2MatchesReferenceVectors() {
        assertEquals(new Address("0x4D1A2e2bB4F88F0250f26Ffff098B0b30B26BF38".toLowerCase()),
            CloneAddresses.create2(Address.ZERO, ZERO_SALT, codeHash("0x00")));
        assertEquals(new Address("0xb928f69bb1d91cd65274e3c79d8986362984fda3"),
            CloneAddresses.create2(new Address("0xdeadbeef00000000000000000000000000000000"), ZERO_SALT,
                codeHash("0x00")));
        assertEquals(new Address("0x70f2b2914a2a4b783faefb75f459a580616fcb5e"),
            CloneAddresses.create2(Address.ZERO, ZERO_SALT, codeHash("0xdeadbeef")));
    }

    @Test
    void cloneInitCodeEmbedsTemplate() {
        Address template = new Address("0x" + "be".repeat(20));
        byte[] code = CloneAddresses.cloneInitCode(template);

        assertEquals(55, code.length);
        assertEquals("0x3d602d80600a3d3981f3363d3d373d3d3d363d73" + "be".repeat(20) + "5af43d82803e903d91602b57fd5bf3",
            Hex.encode(code));
    }

    @Test
    void predictUsesCloneCodeHash() {
        Address deployer = new Address("0x" + "12".repeat(20));
        Address template = new Address("0x" + "34".repeat(20));
        Hash salt = Keccak256.hashUtf8("salt");

        assertEquals(
            CloneAddresses.create2(deployer, salt, CloneAddresses.cloneCodeHash(template)),
            CloneAddresses.predict(deployer, salt, template));
        assertNotEquals(
            CloneAddresses.predict(deployer, salt, template),
            CloneAddresses.predict(deployer, salt, new Address("0x" + "56".repeat(20))));
    }
}
