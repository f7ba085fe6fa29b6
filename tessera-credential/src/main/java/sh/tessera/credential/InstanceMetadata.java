// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.credential;

import sh.tessera.core.credential.InterfaceId;
import sh.tessera.core.types.Address;

/**
 * Metadata about the instance as a whole, writable by its owner.
 */
public interface InstanceMetadata {

    InterfaceId INTERFACE_ID = InterfaceId.ofSignatures(
            "setContractMetadata(string,bytes)",
            "getContractMetadata(string)");

    /**
     * @throws sh.tessera.core.error.NotAuthorizedException if the caller is not the owner
     */
    void setInstanceMetadata(Address caller, String key, byte[] value);

    /**
     * @return the value, or an empty array if never written
     */
    byte[] getInstanceMetadata(String key);
}
