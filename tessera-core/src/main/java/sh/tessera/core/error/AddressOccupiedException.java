// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

import sh.tessera.core.types.Address;

/**
 * Thrown when a deployment targets an address that is already in use, for
 * example when a deterministic-creation salt is reused.
 *
 * @since 0.1.0
 */
public final class AddressOccupiedException extends CredentialException {

    private final Address address;

    public AddressOccupiedException(final Address address) {
        super(ErrorKind.ADDRESS_OCCUPIED, "Address already occupied: " + address.value());
        this.address = address;
    }

    public Address address() {
        return address;
    }
}
