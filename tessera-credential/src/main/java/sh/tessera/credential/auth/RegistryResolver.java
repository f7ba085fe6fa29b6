// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential.auth;

import java.util.Optional;

import sh.tessera.core.types.Address;

/**
 * Resolves a registry address to the registry deployed there.
 */
@FunctionalInterface
public interface RegistryResolver {

    /**
     * @param address the registry address
     * @return the registry, or empty if nothing implementing {@link SubjectRegistry} lives there
     */
    Optional<SubjectRegistry> resolve(Address address);
}
