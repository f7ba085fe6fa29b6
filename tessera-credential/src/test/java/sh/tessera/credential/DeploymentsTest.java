// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sh.tessera.core.error.AddressOccupiedException;
import sh.tessera.core.types.Address;
import sh.tessera.credential.auth.InMemorySubjectRegistry;
import sh.tessera.credential.auth.SubjectRegistry;

class DeploymentsTest {

    private static final Address DEPLOYER = new Address("0x" + "d".repeat(40));

    private final Deployments deployments = new Deployments();

    @Test
    void freshAddressesAreDistinct() {
        Set<Address> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            Address address = deployments.freshAddress(DEPLOYER);
            assertFalse(address.isZero());
            assertTrue(seen.add(address));
        }
    }

    @Test
    void deployRejectsOccupiedAddress() {
        Address address = deployments.freshAddress(DEPLOYER);
        deployments.deploy(address, "first");

        AddressOccupiedException ex =
            assertThrows(AddressOccupiedException.class, () -> deployments.deploy(address, "second"));
        assertEquals(address, ex.address());
        assertEquals("first", deployments.lookup(address, String.class).orElseThrow());
    }

    @Test
    void deployRejectsZeroAddress() {
        assertThrows(IllegalArgumentException.class, () -> deployments.deploy(Address.ZERO, "x"));
    }

    @Test
    void resolvesOnlyRegistries() {
        InMemorySubjectRegistry registry = new InMemorySubjectRegistry();
        Address registryAddress = deployments.deployRegistry(DEPLOYER, registry);
        Address other = deployments.freshAddress(DEPLOYER);
        deployments.deploy(other, "not a registry");

        SubjectRegistry resolved = deployments.resolve(registryAddress).orElseThrow();
        assertSame(registry, resolved);
        assertTrue(deployments.resolve(other).isEmpty());
        assertTrue(deployments.isOccupied(registryAddress));
    }

    @Test
    void lookupChecksType() {
        Address address = deployments.freshAddress(DEPLOYER);
        deployments.deploy(address, "value");
        assertTrue(deployments.lookup(address, Integer.class).isEmpty());
    }
}
