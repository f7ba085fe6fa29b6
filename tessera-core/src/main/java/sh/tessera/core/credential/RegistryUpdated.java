// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import sh.tessera.core.types.Address;

/**
 * The registry an instance resolves subjects through was replaced.
 *
 * @param source           the instance
 * @param previousRegistry the registry before the change ({@link Address#ZERO} on first binding)
 * @param newRegistry      the registry after the change
 */
public record RegistryUpdated(Address source, Address previousRegistry, Address newRegistry)
        implements CredentialEvent {}
