// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.credential;

import sh.tessera.core.types.Address;

/**
 * Instance ownership changed. A renouncement has {@link Address#ZERO} as the new owner.
 *
 * @param source        the instance
 * @param previousOwner the owner before the change
 * @param newOwner      the owner after the change
 */
public record OwnershipTransferred(Address source, Address previousOwner, Address newOwner)
        implements CredentialEvent {}
