// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import sh.tessera.core.credential.InterfaceId;

/**
 * Capability introspection, ERC-165 style.
 */
public interface SupportsInterface {

    /** {@code 0x01ffc9a7}. */
    InterfaceId INTERFACE_ID = InterfaceId.ofSignatures("supportsInterface(bytes4)");

    /**
     * Reports whether the interface identified by {@code interfaceId} is implemented.
     * Unknown identifiers answer {@code false}.
     */
    boolean supportsInterface(InterfaceId interfaceId);
}
